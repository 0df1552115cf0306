package com.wifi.features.extractor.adapter.impl;

import java.util.List;

import org.springframework.stereotype.Component;

import com.wifi.features.extractor.adapter.DeviceAttribute;
import com.wifi.features.extractor.adapter.FieldLayout;

/**
 * Adapter for device records that group fields under namespace sub-objects:
 *
 * <pre>{@code
 * {"kismet.device.base": {"macaddr": "AA:BB:CC:DD:EE:FF", "channel": "6",
 *                         "signal": {"kismet.common.signal.last": -61}}}
 * }</pre>
 */
@Component
public class NestedDeviceFieldAdapter extends AbstractDeviceFieldAdapter {

  @Override
  public FieldLayout getLayout() {
    return FieldLayout.NESTED;
  }

  @Override
  protected List<List<String>> candidatePaths(DeviceAttribute attribute) {
    return attribute.nestedPaths();
  }
}
