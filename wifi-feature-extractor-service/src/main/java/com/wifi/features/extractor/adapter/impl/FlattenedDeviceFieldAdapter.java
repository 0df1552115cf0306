package com.wifi.features.extractor.adapter.impl;

import java.util.List;

import org.springframework.stereotype.Component;

import com.wifi.features.extractor.adapter.DeviceAttribute;
import com.wifi.features.extractor.adapter.FieldLayout;

/**
 * Adapter for device records whose fields are keyed by dotted composite names, as returned by
 * current Kismet releases:
 *
 * <pre>{@code
 * {"kismet.device.base.macaddr": "AA:BB:CC:DD:EE:FF", "kismet.device.base.channel": "6",
 *  "kismet.device.base.signal": {"kismet.common.signal.last_signal": -61}}
 * }</pre>
 */
@Component
public class FlattenedDeviceFieldAdapter extends AbstractDeviceFieldAdapter {

  @Override
  public FieldLayout getLayout() {
    return FieldLayout.FLATTENED;
  }

  @Override
  protected List<List<String>> candidatePaths(DeviceAttribute attribute) {
    return attribute.flattenedPaths();
  }
}
