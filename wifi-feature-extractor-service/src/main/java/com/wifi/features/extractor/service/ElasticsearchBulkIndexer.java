// wifi-feature-extractor-service/src/main/java/com/wifi/features/extractor/service/ElasticsearchBulkIndexer.java
package com.wifi.features.extractor.service;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wifi.features.extractor.config.WebClientConfiguration;
import com.wifi.features.extractor.config.properties.ElasticsearchConfigurationProperties;
import com.wifi.features.extractor.dto.BulkIndexResult;
import com.wifi.features.extractor.dto.FeatureRecord;
import com.wifi.features.extractor.exception.BulkIndexingException;

/**
 * Batch delivery sink that writes feature records to Elasticsearch with one {@code _bulk} request.
 *
 * <p>Every record becomes an {@code index} action targeting the configured index. When an ingest
 * pipeline is configured it is set on every action of the request.
 *
 * <p><strong>Failure Classification:</strong>
 *
 * <ul>
 *   <li><strong>Transport failures</strong> (connection refused, timeout, non-2xx status,
 *       unreadable response): the whole batch failed
 *   <li><strong>Item failures</strong> ({@code "errors": true}): when every item was rejected the
 *       batch failed; when only some were, the failure is partial
 * </ul>
 *
 * <p>Both are reported as {@link BulkIndexingException}; the sink never retries. The next poll
 * cycle re-indexes the current device set anyway.
 */
@Service
public class ElasticsearchBulkIndexer {

  private static final Logger logger = LoggerFactory.getLogger(ElasticsearchBulkIndexer.class);

  static final String BULK_PATH = "/_bulk";
  static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

  private final WebClient webClient;
  private final ElasticsearchConfigurationProperties properties;
  private final ObjectMapper objectMapper;

  public ElasticsearchBulkIndexer(
      @Qualifier(WebClientConfiguration.ELASTICSEARCH_WEB_CLIENT) WebClient webClient,
      ElasticsearchConfigurationProperties properties,
      ObjectMapper objectMapper) {
    if (webClient == null) {
      throw new IllegalArgumentException("WebClient cannot be null");
    }
    if (properties == null) {
      throw new IllegalArgumentException("ElasticsearchConfigurationProperties cannot be null");
    }
    if (objectMapper == null) {
      throw new IllegalArgumentException("ObjectMapper cannot be null");
    }
    this.webClient = webClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  /**
   * Indexes a batch of feature records with a single bulk request.
   *
   * @param records the records to index, in order; null or empty is a no-op
   * @return counts of indexed documents
   * @throws BulkIndexingException if the request fails or any document is rejected
   */
  public BulkIndexResult index(List<FeatureRecord> records) {
    if (records == null || records.isEmpty()) {
      return BulkIndexResult.empty();
    }

    String batchId = UUID.randomUUID().toString();
    String body = buildBulkBody(records);

    logger.debug(
        "Writing batch {} to Elasticsearch: {} documents, {} bytes",
        batchId,
        records.size(),
        body.length());

    String response;
    try {
      response =
          webClient
              .post()
              .uri(BULK_PATH)
              .contentType(NDJSON)
              .accept(MediaType.APPLICATION_JSON)
              .bodyValue(body)
              .retrieve()
              .bodyToMono(String.class)
              .timeout(Duration.ofMillis(properties.requestTimeoutMs()))
              .block();
    } catch (WebClientResponseException e) {
      throw new BulkIndexingException(
          String.format(
              "Elasticsearch rejected bulk request %s with HTTP %d: %s",
              batchId, e.getStatusCode().value(), e.getStatusText()),
          records.size(),
          e);
    } catch (WebClientRequestException e) {
      throw new BulkIndexingException(
          "Failed to connect to Elasticsearch for bulk request " + batchId + ": " + e.getMessage(),
          records.size(),
          e);
    } catch (RuntimeException e) {
      String reason =
          e.getCause() instanceof TimeoutException
              ? "timed out after " + properties.requestTimeoutMs() + "ms"
              : e.getMessage();
      throw new BulkIndexingException(
          "Bulk request " + batchId + " failed: " + reason, records.size(), e);
    }

    BulkIndexResult result = evaluateResponse(response, records.size(), batchId);
    logger.info(
        "Indexed {} documents into {} (took {}ms)",
        result.indexed(),
        properties.index(),
        result.tookMillis());
    return result;
  }

  /** Builds the newline-delimited action/source body. */
  String buildBulkBody(List<FeatureRecord> records) {
    String actionLine = actionLine();
    StringBuilder body = new StringBuilder(records.size() * 512);
    for (FeatureRecord record : records) {
      try {
        body.append(actionLine).append('\n');
        body.append(objectMapper.writeValueAsString(record)).append('\n');
      } catch (JsonProcessingException e) {
        throw new BulkIndexingException(
            "Failed to serialize feature record for " + record.bssid(), records.size(), e);
      }
    }
    return body.toString();
  }

  private String actionLine() {
    ObjectNode target = objectMapper.createObjectNode();
    target.put("_index", properties.index());
    if (properties.hasPipeline()) {
      target.put("pipeline", properties.pipeline());
    }
    ObjectNode action = objectMapper.createObjectNode();
    action.set("index", target);
    return action.toString();
  }

  private BulkIndexResult evaluateResponse(String response, int batchSize, String batchId) {
    JsonNode root;
    try {
      root = response == null ? null : objectMapper.readTree(response);
    } catch (JsonProcessingException e) {
      throw new BulkIndexingException(
          "Unreadable bulk response for batch " + batchId, batchSize, e);
    }
    if (root == null || !root.isObject()) {
      throw new BulkIndexingException(
          "Empty bulk response for batch " + batchId, batchSize, (Throwable) null);
    }

    long took = root.path("took").asLong(0L);
    if (!root.path("errors").asBoolean(false)) {
      return new BulkIndexResult(batchSize, 0, took);
    }

    int failed = 0;
    String firstError = null;
    for (JsonNode item : root.path("items")) {
      JsonNode outcome = item.elements().hasNext() ? item.elements().next() : item;
      if (outcome.has("error") || outcome.path("status").asInt(200) >= 300) {
        failed++;
        if (firstError == null) {
          firstError = describeError(outcome.path("error"));
        }
      }
    }
    int indexed = Math.max(0, batchSize - failed);

    if (failed == 0) {
      return new BulkIndexResult(batchSize, 0, took);
    }

    logger.debug("Batch {} had {} rejected documents, first error: {}", batchId, failed, firstError);
    String message =
        indexed == 0
            ? String.format(
                "All %d documents of batch %s were rejected: %s", batchSize, batchId, firstError)
            : String.format(
                "%d of %d documents of batch %s were rejected: %s",
                failed, batchSize, batchId, firstError);
    throw new BulkIndexingException(message, indexed, failed);
  }

  private static String describeError(JsonNode error) {
    if (error.isMissingNode() || error.isNull()) {
      return "unknown error";
    }
    if (error.isTextual()) {
      return error.asText();
    }
    return error.path("type").asText("error") + ": " + error.path("reason").asText("");
  }
}
