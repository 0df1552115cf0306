package com.wifi.features.extractor.adapter;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Factory that selects the {@link DeviceFieldAdapter} matching a configured {@link FieldLayout}.
 *
 * <p>All adapters are registered as Spring components; the factory indexes them by the layout they
 * report so that new conventions can be added without touching the feature builder.
 */
@Service
public class DeviceFieldAdapterFactory {

  private static final Logger logger = LoggerFactory.getLogger(DeviceFieldAdapterFactory.class);

  private final Map<FieldLayout, DeviceFieldAdapter> adaptersByLayout;

  /**
   * Creates the factory from every available adapter.
   *
   * @param adapters adapter implementations, one per layout
   * @throws IllegalArgumentException if adapters is null
   * @throws IllegalStateException if two adapters claim the same layout
   */
  public DeviceFieldAdapterFactory(List<DeviceFieldAdapter> adapters) {
    if (adapters == null) {
      throw new IllegalArgumentException("Device field adapters cannot be null");
    }
    this.adaptersByLayout =
        adapters.stream()
            .collect(
                Collectors.toUnmodifiableMap(DeviceFieldAdapter::getLayout, Function.identity()));
    logger.info("DeviceFieldAdapterFactory initialized with layouts {}", adaptersByLayout.keySet());
  }

  /**
   * Returns the adapter for a layout.
   *
   * @param layout the configured layout
   * @return the matching adapter
   * @throws IllegalStateException if no adapter handles the layout
   */
  public DeviceFieldAdapter getAdapter(FieldLayout layout) {
    DeviceFieldAdapter adapter = adaptersByLayout.get(layout);
    if (adapter == null) {
      throw new IllegalStateException("No device field adapter registered for layout " + layout);
    }
    return adapter;
  }
}
