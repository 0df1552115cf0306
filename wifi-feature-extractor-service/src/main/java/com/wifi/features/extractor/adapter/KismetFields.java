package com.wifi.features.extractor.adapter;

/** Kismet JSON namespaces and field names used to locate device attributes. */
public final class KismetFields {

  /** Namespace of the common per-device fields. */
  public static final String DEVICE_BASE = "kismet.device.base";

  /** Namespace of the signal statistics sub-object. */
  public static final String SIGNAL = "kismet.common.signal";

  /** Namespace of 802.11-specific device fields. */
  public static final String DOT11_DEVICE = "dot11.device";

  /** Prefix shared by every flattened device-base key. */
  public static final String FLATTENED_PREFIX = DEVICE_BASE + ".";

  private KismetFields() {}

  /** Returns the fully-qualified key of a field in the given namespace. */
  public static String qualified(String namespace, String field) {
    return namespace + "." + field;
  }
}
