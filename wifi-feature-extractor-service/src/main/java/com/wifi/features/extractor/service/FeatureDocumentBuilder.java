// wifi-feature-extractor-service/src/main/java/com/wifi/features/extractor/service/FeatureDocumentBuilder.java
package com.wifi.features.extractor.service;

import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.wifi.features.extractor.adapter.DeviceAttribute;
import com.wifi.features.extractor.adapter.DeviceFieldAdapter;
import com.wifi.features.extractor.adapter.DeviceFieldAdapterFactory;
import com.wifi.features.extractor.config.properties.KismetConfigurationProperties;
import com.wifi.features.extractor.config.properties.SensorConfigurationProperties;
import com.wifi.features.extractor.dto.FeatureRecord;
import com.wifi.features.extractor.util.EpochTimestampNormalizer;
import com.wifi.features.extractor.util.SsidEntropyCalculator;

/**
 * Core service that maps a raw Kismet device record into a {@link FeatureRecord}.
 *
 * <p>This service implements the extraction and normalization step of the collector. Field lookup
 * is delegated to the configured {@link DeviceFieldAdapter}, so the mapping below is expressed only
 * in terms of logical {@link DeviceAttribute}s and does not depend on Kismet's field layout.
 *
 * <p><strong>Mapping Rules:</strong>
 *
 * <ul>
 *   <li><strong>Hardware address:</strong> mandatory; records without one are not wireless
 *       endpoints and are skipped
 *   <li><strong>SSID:</strong> advertised name, falling back to the common name
 *   <li><strong>SSID entropy:</strong> Shannon entropy of the SSID, 0.0 without one
 *   <li><strong>Manufacturer, channel, PHY:</strong> passed through with their JSON types
 *   <li><strong>First/last seen:</strong> converted from epoch seconds when reported
 *   <li><strong>Document timestamp:</strong> last-seen time, else the cycle start
 *   <li><strong>Signal statistics:</strong> numeric values only, absent otherwise
 *   <li><strong>Client count:</strong> defaults to 0
 * </ul>
 *
 * <p>The builder is stateless and thread-safe. Building the same record twice with the same cycle
 * timestamp yields equal results.
 *
 * @author WiFi Location Data Pipeline Team
 * @version 1.0
 * @since 2024
 */
@Service
public class FeatureDocumentBuilder {

  private static final Logger logger = LoggerFactory.getLogger(FeatureDocumentBuilder.class);

  private final DeviceFieldAdapter fieldAdapter;
  private final String sensorId;
  private final String sensorSite;

  /**
   * Constructs the builder for the configured field layout and sensor identity.
   *
   * @param adapterFactory factory that provides the adapter for the configured layout
   * @param kismetProperties Kismet configuration, supplies the field layout
   * @param sensorProperties sensor identity stamped on every document
   * @throws IllegalArgumentException if any required dependency is null
   */
  @Autowired
  public FeatureDocumentBuilder(
      DeviceFieldAdapterFactory adapterFactory,
      KismetConfigurationProperties kismetProperties,
      SensorConfigurationProperties sensorProperties) {
    this(
        requireFactory(adapterFactory).getAdapter(requireKismet(kismetProperties).fieldLayout()),
        sensorProperties);
  }

  /**
   * Constructs the builder around an explicit adapter.
   *
   * @param fieldAdapter adapter used to resolve device attributes
   * @param sensorProperties sensor identity stamped on every document
   * @throws IllegalArgumentException if any required dependency is null
   */
  public FeatureDocumentBuilder(
      DeviceFieldAdapter fieldAdapter, SensorConfigurationProperties sensorProperties) {
    if (fieldAdapter == null) {
      throw new IllegalArgumentException("DeviceFieldAdapter cannot be null");
    }
    if (sensorProperties == null) {
      throw new IllegalArgumentException("SensorConfigurationProperties cannot be null");
    }

    this.fieldAdapter = fieldAdapter;
    this.sensorId = sensorProperties.resolvedId();
    this.sensorSite = sensorProperties.site();

    logger.info(
        "Feature Document Builder initialized: sensorId={}, site={}, layout={}",
        sensorId,
        sensorSite,
        fieldAdapter.getLayout());
  }

  /**
   * Builds the feature record for one device.
   *
   * @param device the raw Kismet device record
   * @param cycleTimestamp start of the current collection cycle, used when the device carries no
   *     usable last-seen time
   * @return the feature record, or empty if the device has no hardware address
   * @throws IllegalArgumentException if cycleTimestamp is null
   */
  public Optional<FeatureRecord> build(JsonNode device, Instant cycleTimestamp) {
    if (cycleTimestamp == null) {
      throw new IllegalArgumentException("Cycle timestamp cannot be null");
    }

    Optional<String> bssid = fieldAdapter.hardwareAddress(device);
    if (bssid.isEmpty()) {
      logger.debug("Skipping device without hardware address");
      return Optional.empty();
    }

    String ssid = fieldAdapter.displayName(device).orElse(null);

    Instant firstSeen = epochInstant(device, DeviceAttribute.FIRST_TIME, cycleTimestamp);
    Instant lastSeen = epochInstant(device, DeviceAttribute.LAST_TIME, cycleTimestamp);

    return Optional.of(
        FeatureRecord.builder()
            .timestamp(lastSeen != null ? lastSeen : cycleTimestamp)
            .sensorId(sensorId)
            .sensorSite(sensorSite)
            .bssid(bssid.get())
            .ssid(ssid)
            .ssidEntropy(SsidEntropyCalculator.entropy(ssid))
            .manufacturer(scalar(device, DeviceAttribute.MANUFACTURER))
            .channel(scalar(device, DeviceAttribute.CHANNEL))
            .phyType(scalar(device, DeviceAttribute.PHY_NAME))
            .firstSeen(firstSeen)
            .lastSeen(lastSeen)
            .rssiLast(number(device, DeviceAttribute.SIGNAL_LAST))
            .rssiMin(number(device, DeviceAttribute.SIGNAL_MIN))
            .rssiMax(number(device, DeviceAttribute.SIGNAL_MAX))
            .rssiMean(number(device, DeviceAttribute.SIGNAL_AVG))
            .clientCount(clientCount(device))
            .build());
  }

  /** Converts a reported epoch value; unreported (missing or zero) values stay null. */
  private Instant epochInstant(JsonNode device, DeviceAttribute attribute, Instant fallback) {
    return fieldAdapter
        .resolve(device, attribute)
        .filter(EpochTimestampNormalizer::isPresent)
        .map(value -> EpochTimestampNormalizer.normalize(value, fallback))
        .orElse(null);
  }

  /** Returns a scalar value with its JSON type preserved: text, number or boolean. */
  private Object scalar(JsonNode device, DeviceAttribute attribute) {
    return fieldAdapter
        .resolve(device, attribute)
        .filter(JsonNode::isValueNode)
        .map(
            node -> {
              if (node.isNumber()) {
                return (Object) node.numberValue();
              }
              if (node.isBoolean()) {
                return node.booleanValue();
              }
              return node.asText();
            })
        .orElse(null);
  }

  private Number number(JsonNode device, DeviceAttribute attribute) {
    return fieldAdapter
        .resolve(device, attribute)
        .filter(JsonNode::isNumber)
        .map(JsonNode::numberValue)
        .orElse(null);
  }

  private int clientCount(JsonNode device) {
    return fieldAdapter
        .resolve(device, DeviceAttribute.NUM_CLIENTS)
        .filter(node -> node.isNumber() || node.isTextual())
        .map(node -> node.asInt(0))
        .orElse(0);
  }

  private static DeviceFieldAdapterFactory requireFactory(DeviceFieldAdapterFactory factory) {
    if (factory == null) {
      throw new IllegalArgumentException("DeviceFieldAdapterFactory cannot be null");
    }
    return factory;
  }

  private static KismetConfigurationProperties requireKismet(
      KismetConfigurationProperties properties) {
    if (properties == null) {
      throw new IllegalArgumentException("KismetConfigurationProperties cannot be null");
    }
    return properties;
  }
}
