// wifi-feature-extractor-service/src/main/java/com/wifi/features/extractor/client/KismetDeviceClient.java
package com.wifi.features.extractor.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wifi.features.extractor.config.WebClientConfiguration;
import com.wifi.features.extractor.config.properties.KismetConfigurationProperties;
import com.wifi.features.extractor.exception.DeviceSourceException;

/**
 * Client for the Kismet REST API. Fetches the devices that were active within the configured
 * relative time window.
 *
 * <p>Uses the documented endpoint {@code /devices/last-time/{TIMESTAMP}/devices.json}, where a
 * negative timestamp means "seconds before now". The response is expected to be a JSON array of
 * device objects. Every failure (connection, timeout, HTTP error, malformed body) is reported as a
 * {@link DeviceSourceException}; the client never retries.
 */
@Service
public class KismetDeviceClient {

  private static final Logger logger = LoggerFactory.getLogger(KismetDeviceClient.class);

  static final String DEVICES_PATH = "/devices/last-time/-{window}/devices.json";

  private final WebClient webClient;
  private final KismetConfigurationProperties properties;
  private final ObjectMapper objectMapper;

  public KismetDeviceClient(
      @Qualifier(WebClientConfiguration.KISMET_WEB_CLIENT) WebClient webClient,
      KismetConfigurationProperties properties,
      ObjectMapper objectMapper) {
    if (webClient == null) {
      throw new IllegalArgumentException("WebClient cannot be null");
    }
    if (properties == null) {
      throw new IllegalArgumentException("KismetConfigurationProperties cannot be null");
    }
    if (objectMapper == null) {
      throw new IllegalArgumentException("ObjectMapper cannot be null");
    }
    this.webClient = webClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  /**
   * Fetches the devices active within the configured window.
   *
   * @return the raw device records, in the order Kismet returned them
   * @throws DeviceSourceException if the request fails or the body is not a JSON array
   */
  public List<JsonNode> fetchRecentDevices() {
    logger.debug(
        "Requesting Kismet devices active in the last {}s from {}",
        properties.windowSeconds(),
        properties.baseUrl());

    long startTime = System.nanoTime();
    String body;
    try {
      body =
          webClient
              .get()
              .uri(DEVICES_PATH, properties.windowSeconds())
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .bodyToMono(String.class)
              .timeout(Duration.ofMillis(properties.requestTimeoutMs()))
              .block();
    } catch (WebClientResponseException e) {
      throw new DeviceSourceException(
          String.format("Kismet returned HTTP %d: %s", e.getStatusCode().value(), e.getStatusText()),
          e);
    } catch (WebClientRequestException e) {
      throw new DeviceSourceException("Failed to connect to Kismet: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      if (e.getCause() instanceof TimeoutException) {
        throw new DeviceSourceException(
            "Kismet did not answer within " + properties.requestTimeoutMs() + "ms", e);
      }
      throw new DeviceSourceException("Unexpected error fetching Kismet devices: " + e.getMessage(), e);
    }

    List<JsonNode> devices = parseDevices(body);
    long latencyMs = (System.nanoTime() - startTime) / 1_000_000;
    logger.debug("Fetched {} Kismet devices in {}ms", devices.size(), latencyMs);
    return devices;
  }

  private List<JsonNode> parseDevices(String body) {
    if (body == null || body.isBlank()) {
      throw new DeviceSourceException("Kismet returned an empty response body");
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new DeviceSourceException("Kismet returned invalid JSON: " + e.getOriginalMessage(), e);
    }

    if (root == null || !root.isArray()) {
      throw new DeviceSourceException(
          "Kismet response is not a JSON array but "
              + (root == null ? "empty" : root.getNodeType()));
    }

    List<JsonNode> devices = new ArrayList<>(root.size());
    root.forEach(devices::add);
    return devices;
  }
}
