package com.wifi.features.extractor.adapter;

/** Field naming conventions a Kismet device record can arrive in. */
public enum FieldLayout {
  /** Fields grouped in namespace sub-objects, e.g. {@code {"kismet.device.base": {"macaddr": ..}}}. */
  NESTED,
  /** Fields keyed by dotted composite names, e.g. {@code {"kismet.device.base.macaddr": ..}}. */
  FLATTENED,
  /** Convention probed per record. */
  AUTO
}
