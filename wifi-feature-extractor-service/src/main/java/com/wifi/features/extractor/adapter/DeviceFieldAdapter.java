package com.wifi.features.extractor.adapter;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Resolves logical attributes of a Kismet device record independently of the record's field
 * naming convention.
 *
 * <p>Kismet has shipped device records both with namespace sub-objects and with flattened dotted
 * keys. Implementations encapsulate one convention (or detect it) so that callers only deal with
 * {@link DeviceAttribute} values. Every attribute is independently optional; a missing attribute
 * is never an error.
 *
 * <p>Implementations must be stateless and thread-safe.
 */
public interface DeviceFieldAdapter {

  /**
   * Gets the field layout this adapter handles.
   *
   * @return the supported layout, {@link FieldLayout#AUTO} for detecting adapters
   */
  FieldLayout getLayout();

  /**
   * Resolves a logical attribute against a device record.
   *
   * @param device the raw device record, may be null or a non-object node
   * @param attribute the attribute to resolve
   * @return the raw JSON value, empty when the attribute is missing or JSON null
   */
  Optional<JsonNode> resolve(JsonNode device, DeviceAttribute attribute);

  /**
   * Resolves a scalar attribute as text, treating blank values as absent.
   *
   * @param device the raw device record
   * @param attribute the attribute to resolve
   * @return the non-blank text value, or empty
   */
  default Optional<String> resolveText(JsonNode device, DeviceAttribute attribute) {
    return resolve(device, attribute)
        .filter(JsonNode::isValueNode)
        .map(JsonNode::asText)
        .filter(text -> !text.isBlank());
  }

  /**
   * Resolves the hardware (MAC) address of the device.
   *
   * @param device the raw device record
   * @return the hardware address, empty when the record is not a wireless endpoint
   */
  default Optional<String> hardwareAddress(JsonNode device) {
    return resolveText(device, DeviceAttribute.MAC_ADDRESS);
  }

  /**
   * Resolves the display name of the device. The advertised name is preferred; the common name
   * is used when no name is present.
   *
   * @param device the raw device record
   * @return the display name, or empty
   */
  default Optional<String> displayName(JsonNode device) {
    return resolveText(device, DeviceAttribute.NAME)
        .or(() -> resolveText(device, DeviceAttribute.COMMON_NAME));
  }
}
