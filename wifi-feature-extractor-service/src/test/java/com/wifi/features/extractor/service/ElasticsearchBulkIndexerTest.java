// wifi-feature-extractor-service/src/test/java/com/wifi/features/extractor/service/ElasticsearchBulkIndexerTest.java

package com.wifi.features.extractor.service;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wifi.features.extractor.config.WebClientConfiguration;
import com.wifi.features.extractor.config.properties.ElasticsearchConfigurationProperties;
import com.wifi.features.extractor.dto.BulkIndexResult;
import com.wifi.features.extractor.dto.FeatureRecord;
import com.wifi.features.extractor.exception.BulkIndexingException;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.tls.HandshakeCertificates;
import okhttp3.tls.HeldCertificate;

/** Tests ElasticsearchBulkIndexer against a mock Elasticsearch node. */
class ElasticsearchBulkIndexerTest {

  private final ObjectMapper objectMapper =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private MockWebServer elasticsearch;

  @BeforeEach
  void setUp() throws IOException {
    elasticsearch = new MockWebServer();
    elasticsearch.start();
  }

  @AfterEach
  void tearDown() throws IOException {
    elasticsearch.shutdown();
  }

  private ElasticsearchBulkIndexer indexer(String pipeline) {
    return indexer(
        "http://" + elasticsearch.getHostName() + ":" + elasticsearch.getPort(), pipeline, true);
  }

  private ElasticsearchBulkIndexer indexer(
      String url, String pipeline, boolean verifyCertificates) {
    ElasticsearchConfigurationProperties properties =
        new ElasticsearchConfigurationProperties(
            url,
            "wids-wireless-features",
            "elastic",
            "changeme",
            pipeline,
            verifyCertificates,
            1000,
            2000L);
    return new ElasticsearchBulkIndexer(
        new WebClientConfiguration().elasticsearchWebClient(properties), properties, objectMapper);
  }

  private static FeatureRecord record(String bssid) {
    return FeatureRecord.builder()
        .timestamp(Instant.parse("2024-05-01T12:00:00Z"))
        .sensorId("sensor-01")
        .sensorSite("lab")
        .bssid(bssid)
        .ssid("Guest")
        .ssidEntropy(1.5)
        .channel(6)
        .build();
  }

  private static MockResponse bulkResponse(String body) {
    return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
  }

  @Test
  void shouldSendNdjsonBulkRequestWithPipeline() throws Exception {
    elasticsearch.enqueue(
        bulkResponse(
            "{\"took\":12,\"errors\":false,\"items\":["
                + "{\"index\":{\"status\":201}},{\"index\":{\"status\":201}}]}"));

    BulkIndexResult result =
        indexer("wids-enrich").index(List.of(record("AA:AA:AA:AA:AA:AA"), record("BB:BB:BB:BB:BB:BB")));

    assertThat(result.indexed()).isEqualTo(2);
    assertThat(result.failed()).isZero();
    assertThat(result.tookMillis()).isEqualTo(12);

    RecordedRequest request = elasticsearch.takeRequest();
    assertThat(request.getMethod()).isEqualTo("POST");
    assertThat(request.getPath()).isEqualTo("/_bulk");
    assertThat(request.getHeader("Content-Type")).startsWith("application/x-ndjson");
    assertThat(request.getHeader("Authorization")).startsWith("Basic ");

    String body = request.getBody().readUtf8();
    assertThat(body).endsWith("\n");
    String[] lines = body.split("\n");
    assertThat(lines).hasSize(4);

    JsonNode action = objectMapper.readTree(lines[0]);
    assertThat(action.at("/index/_index").asText()).isEqualTo("wids-wireless-features");
    assertThat(action.at("/index/pipeline").asText()).isEqualTo("wids-enrich");

    JsonNode document = objectMapper.readTree(lines[1]);
    assertThat(document.get("bssid").asText()).isEqualTo("AA:AA:AA:AA:AA:AA");
    assertThat(document.get("@timestamp").asText()).isEqualTo("2024-05-01T12:00:00Z");
    assertThat(document.get("channel").asInt()).isEqualTo(6);
    assertThat(document.has("rssi_last")).isTrue();
    assertThat(document.get("rssi_last").isNull()).isTrue();

    assertThat(objectMapper.readTree(lines[3]).get("bssid").asText())
        .isEqualTo("BB:BB:BB:BB:BB:BB");
  }

  @Test
  void shouldOmitPipelineWhenNotConfigured() throws Exception {
    elasticsearch.enqueue(bulkResponse("{\"took\":1,\"errors\":false,\"items\":[]}"));

    indexer("").index(List.of(record("AA:AA:AA:AA:AA:AA")));

    String actionLine = elasticsearch.takeRequest().getBody().readUtf8().split("\n")[0];
    assertThat(objectMapper.readTree(actionLine).at("/index").has("pipeline")).isFalse();
  }

  @Test
  void shouldNotCallElasticsearchForEmptyBatch() {
    assertThat(indexer(null).index(List.of())).isEqualTo(BulkIndexResult.empty());
    assertThat(indexer(null).index(null)).isEqualTo(BulkIndexResult.empty());
    assertThat(elasticsearch.getRequestCount()).isZero();
  }

  @Test
  void shouldReportPartialFailureWhenSomeItemsRejected() {
    elasticsearch.enqueue(
        bulkResponse(
            "{\"took\":5,\"errors\":true,\"items\":["
                + "{\"index\":{\"status\":201}},"
                + "{\"index\":{\"status\":400,\"error\":{\"type\":\"mapper_parsing_exception\","
                + "\"reason\":\"failed to parse field [channel]\"}}},"
                + "{\"index\":{\"status\":201}}]}"));

    assertThatThrownBy(
            () ->
                indexer(null)
                    .index(
                        List.of(
                            record("AA:AA:AA:AA:AA:AA"),
                            record("BB:BB:BB:BB:BB:BB"),
                            record("CC:CC:CC:CC:CC:CC"))))
        .isInstanceOfSatisfying(
            BulkIndexingException.class,
            e -> {
              assertThat(e.isPartial()).isTrue();
              assertThat(e.getIndexedCount()).isEqualTo(2);
              assertThat(e.getFailedCount()).isEqualTo(1);
              assertThat(e.getMessage()).contains("mapper_parsing_exception");
            });
  }

  @Test
  void shouldReportTotalFailureWhenAllItemsRejected() {
    elasticsearch.enqueue(
        bulkResponse(
            "{\"took\":5,\"errors\":true,\"items\":["
                + "{\"index\":{\"status\":403,\"error\":{\"type\":\"cluster_block_exception\","
                + "\"reason\":\"index read-only\"}}}]}"));

    assertThatThrownBy(() -> indexer(null).index(List.of(record("AA:AA:AA:AA:AA:AA"))))
        .isInstanceOfSatisfying(
            BulkIndexingException.class,
            e -> {
              assertThat(e.isPartial()).isFalse();
              assertThat(e.getIndexedCount()).isZero();
              assertThat(e.getFailedCount()).isEqualTo(1);
            });
  }

  @Test
  void shouldFailWholeBatchOnHttpError() {
    elasticsearch.enqueue(new MockResponse().setResponseCode(503));

    assertThatThrownBy(
            () -> indexer(null).index(List.of(record("AA:AA:AA:AA:AA:AA"), record("BB"))))
        .isInstanceOfSatisfying(
            BulkIndexingException.class,
            e -> {
              assertThat(e.isPartial()).isFalse();
              assertThat(e.getFailedCount()).isEqualTo(2);
              assertThat(e.getMessage()).contains("HTTP 503");
            });
  }

  @Test
  void shouldFailOnUnreadableResponse() {
    elasticsearch.enqueue(bulkResponse("<html>proxy error</html>"));

    assertThatThrownBy(() -> indexer(null).index(List.of(record("AA:AA:AA:AA:AA:AA"))))
        .isInstanceOf(BulkIndexingException.class)
        .hasMessageContaining("Unreadable bulk response");
  }

  private void serveSelfSignedHttps() {
    HeldCertificate selfSigned =
        new HeldCertificate.Builder()
            .commonName("localhost")
            .addSubjectAlternativeName("localhost")
            .build();
    HandshakeCertificates serverCertificates =
        new HandshakeCertificates.Builder().heldCertificate(selfSigned).build();
    elasticsearch.useHttps(serverCertificates.sslSocketFactory(), false);
  }

  @Test
  void shouldIndexOverSelfSignedTlsWhenVerificationDisabled() throws Exception {
    serveSelfSignedHttps();
    elasticsearch.enqueue(
        bulkResponse("{\"took\":3,\"errors\":false,\"items\":[{\"index\":{\"status\":201}}]}"));

    BulkIndexResult result =
        indexer("https://localhost:" + elasticsearch.getPort(), null, false)
            .index(List.of(record("AA:AA:AA:AA:AA:AA")));

    assertThat(result.indexed()).isEqualTo(1);
    assertThat(elasticsearch.takeRequest().getPath()).isEqualTo("/_bulk");
  }

  @Test
  void shouldRejectSelfSignedTlsWhenVerificationEnabled() {
    serveSelfSignedHttps();
    elasticsearch.enqueue(bulkResponse("{\"took\":3,\"errors\":false,\"items\":[]}"));

    assertThatThrownBy(
            () ->
                indexer("https://localhost:" + elasticsearch.getPort(), null, true)
                    .index(List.of(record("AA:AA:AA:AA:AA:AA"))))
        .isInstanceOfSatisfying(
            BulkIndexingException.class,
            e -> {
              assertThat(e.isPartial()).isFalse();
              assertThat(e.getFailedCount()).isEqualTo(1);
            });
  }

  @Test
  void shouldIndexOverPlainHttpWhenVerificationDisabled() {
    elasticsearch.enqueue(bulkResponse("{\"took\":1,\"errors\":false,\"items\":[]}"));

    BulkIndexResult result =
        indexer(
                "http://" + elasticsearch.getHostName() + ":" + elasticsearch.getPort(),
                null,
                false)
            .index(List.of(record("AA:AA:AA:AA:AA:AA")));

    assertThat(result.indexed()).isEqualTo(1);
  }
}
