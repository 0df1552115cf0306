package com.wifi.features.extractor.adapter.impl;

import java.util.Iterator;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.wifi.features.extractor.adapter.DeviceAttribute;
import com.wifi.features.extractor.adapter.DeviceFieldAdapter;
import com.wifi.features.extractor.adapter.FieldLayout;
import com.wifi.features.extractor.adapter.KismetFields;

/**
 * Adapter that probes every record for its layout and delegates to the matching strategy.
 *
 * <p>A record is treated as flattened when any top-level key carries the device-base prefix
 * ({@code kismet.device.base.}); otherwise it is treated as nested. Probing per record keeps a
 * single poll tolerant of mixed layouts.
 */
@Component
public class AutoDetectingDeviceFieldAdapter implements DeviceFieldAdapter {

  private final NestedDeviceFieldAdapter nestedAdapter;
  private final FlattenedDeviceFieldAdapter flattenedAdapter;

  public AutoDetectingDeviceFieldAdapter(
      NestedDeviceFieldAdapter nestedAdapter, FlattenedDeviceFieldAdapter flattenedAdapter) {
    if (nestedAdapter == null) {
      throw new IllegalArgumentException("NestedDeviceFieldAdapter cannot be null");
    }
    if (flattenedAdapter == null) {
      throw new IllegalArgumentException("FlattenedDeviceFieldAdapter cannot be null");
    }
    this.nestedAdapter = nestedAdapter;
    this.flattenedAdapter = flattenedAdapter;
  }

  @Override
  public FieldLayout getLayout() {
    return FieldLayout.AUTO;
  }

  @Override
  public Optional<JsonNode> resolve(JsonNode device, DeviceAttribute attribute) {
    return delegateFor(device).resolve(device, attribute);
  }

  /**
   * Detects the layout of a single device record.
   *
   * @param device the raw device record
   * @return {@link FieldLayout#FLATTENED} or {@link FieldLayout#NESTED}
   */
  public FieldLayout detectLayout(JsonNode device) {
    if (device != null && device.isObject()) {
      Iterator<String> fieldNames = device.fieldNames();
      while (fieldNames.hasNext()) {
        if (fieldNames.next().startsWith(KismetFields.FLATTENED_PREFIX)) {
          return FieldLayout.FLATTENED;
        }
      }
    }
    return FieldLayout.NESTED;
  }

  private DeviceFieldAdapter delegateFor(JsonNode device) {
    return detectLayout(device) == FieldLayout.FLATTENED ? flattenedAdapter : nestedAdapter;
  }
}
