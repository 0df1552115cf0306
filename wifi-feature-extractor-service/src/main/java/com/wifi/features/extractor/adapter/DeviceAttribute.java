package com.wifi.features.extractor.adapter;

import static com.wifi.features.extractor.adapter.KismetFields.DEVICE_BASE;
import static com.wifi.features.extractor.adapter.KismetFields.DOT11_DEVICE;
import static com.wifi.features.extractor.adapter.KismetFields.SIGNAL;
import static com.wifi.features.extractor.adapter.KismetFields.qualified;

import java.util.List;

/**
 * Logical attributes of a Kismet device record.
 *
 * <p>Each attribute lists, per field layout, the key paths it may be found under. A key path is the
 * sequence of JSON object keys walked from the device root; candidates are tried in order and the
 * first non-null value wins.
 */
public enum DeviceAttribute {
  MAC_ADDRESS(baseNested("macaddr"), baseFlattened("macaddr")),
  NAME(baseNested("name"), baseFlattened("name")),
  COMMON_NAME(baseNested("commonname"), baseFlattened("commonname")),
  MANUFACTURER(baseNested("manuf"), baseFlattened("manuf")),
  CHANNEL(baseNested("channel"), baseFlattened("channel")),
  PHY_NAME(baseNested("phyname"), baseFlattened("phyname")),
  FIRST_TIME(baseNested("first_time"), baseFlattened("first_time")),
  LAST_TIME(baseNested("last_time"), baseFlattened("last_time")),
  NUM_CLIENTS(
      List.of(
          List.of(DEVICE_BASE, "num_clients"),
          List.of(DEVICE_BASE, qualified(DEVICE_BASE, "num_clients")),
          List.of(DOT11_DEVICE, "num_associated_clients"),
          List.of(DOT11_DEVICE, qualified(DOT11_DEVICE, "num_associated_clients"))),
      List.of(
          List.of(qualified(DEVICE_BASE, "num_clients")),
          List.of(DOT11_DEVICE, qualified(DOT11_DEVICE, "num_associated_clients")),
          List.of(qualified(DOT11_DEVICE, "num_associated_clients")))),
  SIGNAL_LAST(signalNested("last", "last_signal"), signalFlattened("last_signal", "last")),
  SIGNAL_MIN(signalNested("min", "min_signal"), signalFlattened("min_signal", "min")),
  SIGNAL_MAX(signalNested("max", "max_signal"), signalFlattened("max_signal", "max")),
  SIGNAL_AVG(signalNested("avg", "avg_signal"), signalFlattened("avg_signal", "avg"));

  private final List<List<String>> nestedPaths;
  private final List<List<String>> flattenedPaths;

  DeviceAttribute(List<List<String>> nestedPaths, List<List<String>> flattenedPaths) {
    this.nestedPaths = nestedPaths;
    this.flattenedPaths = flattenedPaths;
  }

  /** Candidate key paths for records in the nested layout. */
  public List<List<String>> nestedPaths() {
    return nestedPaths;
  }

  /** Candidate key paths for records in the flattened layout. */
  public List<List<String>> flattenedPaths() {
    return flattenedPaths;
  }

  // Nested records have been seen with both short and fully-qualified keys inside the namespace.
  private static List<List<String>> baseNested(String field) {
    return List.of(List.of(DEVICE_BASE, field), List.of(DEVICE_BASE, qualified(DEVICE_BASE, field)));
  }

  private static List<List<String>> baseFlattened(String field) {
    return List.of(List.of(qualified(DEVICE_BASE, field)));
  }

  private static List<List<String>> signalNested(String primary, String secondary) {
    return List.of(
        List.of(DEVICE_BASE, "signal", qualified(SIGNAL, primary)),
        List.of(DEVICE_BASE, "signal", qualified(SIGNAL, secondary)),
        List.of(DEVICE_BASE, qualified(DEVICE_BASE, "signal"), qualified(SIGNAL, primary)),
        List.of(DEVICE_BASE, qualified(DEVICE_BASE, "signal"), qualified(SIGNAL, secondary)));
  }

  private static List<List<String>> signalFlattened(String primary, String secondary) {
    return List.of(
        List.of(qualified(DEVICE_BASE, "signal"), qualified(SIGNAL, primary)),
        List.of(qualified(DEVICE_BASE, "signal"), qualified(SIGNAL, secondary)));
  }
}
