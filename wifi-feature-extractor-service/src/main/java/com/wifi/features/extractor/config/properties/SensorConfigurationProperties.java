package com.wifi.features.extractor.config.properties;

import java.net.InetAddress;
import java.net.UnknownHostException;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Static identity of the collecting sensor, stamped on every feature document.
 *
 * @param id sensor identifier; the local host name is used when blank
 * @param site site label, e.g. "lab" or "warehouse-2"
 */
@ConfigurationProperties(prefix = "sensor")
@Validated
public record SensorConfigurationProperties(
    String id, @NotBlank(message = "Sensor site is required") String site) {

  private static final String UNKNOWN_HOST = "unknown-sensor";

  /** Returns the configured sensor id, falling back to the local host name. */
  public String resolvedId() {
    if (id != null && !id.isBlank()) {
      return id;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return UNKNOWN_HOST;
    }
  }
}
