package com.wifi.features.extractor.adapter.impl;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.wifi.features.extractor.adapter.DeviceAttribute;
import com.wifi.features.extractor.adapter.DeviceFieldAdapter;

/**
 * Base class for adapters that resolve attributes by walking a fixed list of candidate key paths.
 */
public abstract class AbstractDeviceFieldAdapter implements DeviceFieldAdapter {

  /**
   * Returns the candidate key paths of an attribute for this adapter's layout, in priority order.
   *
   * @param attribute the attribute to look up
   * @return candidate key paths
   */
  protected abstract List<List<String>> candidatePaths(DeviceAttribute attribute);

  @Override
  public Optional<JsonNode> resolve(JsonNode device, DeviceAttribute attribute) {
    if (device == null || !device.isObject() || attribute == null) {
      return Optional.empty();
    }
    for (List<String> path : candidatePaths(attribute)) {
      JsonNode value = walk(device, path);
      if (value != null && !value.isNull() && !value.isMissingNode()) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }

  private static JsonNode walk(JsonNode root, List<String> path) {
    JsonNode current = root;
    for (String key : path) {
      if (current == null || !current.isObject()) {
        return null;
      }
      current = current.get(key);
    }
    return current;
  }
}
