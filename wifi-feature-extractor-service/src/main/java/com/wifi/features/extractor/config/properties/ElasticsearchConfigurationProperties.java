package com.wifi.features.extractor.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the Elasticsearch bulk indexing sink. Handles the destination index,
 * the optional ingest pipeline, credentials and transport settings.
 */
@ConfigurationProperties(prefix = "elasticsearch")
@Validated
public record ElasticsearchConfigurationProperties(

    /** Base URL of the Elasticsearch cluster, e.g. http://localhost:9200. */
    @NotBlank(message = "Elasticsearch URL is required") String url,

    /** Destination index every feature document is written to. */
    @NotBlank(message = "Elasticsearch index name is required") String index,

    /** Optional basic-auth user name. Blank disables authentication. */
    String username,

    /** Optional basic-auth password. */
    String password,

    /** Optional ingest pipeline applied to every action of a bulk request. */
    String pipeline,

    /** Whether server certificates are validated. Disable only for self-signed lab clusters. */
    boolean verifyCertificates,

    /** Connect timeout for the bulk endpoint in milliseconds. */
    @Min(value = 100, message = "Connect timeout must be at least 100ms")
        @Max(value = 60000, message = "Connect timeout cannot exceed 60 seconds")
        int connectTimeoutMs,

    /** Upper bound for one bulk request, including reading the response. */
    @Positive(message = "Request timeout must be positive") long requestTimeoutMs) {

  /** Returns true when both user name and password are configured. */
  public boolean hasCredentials() {
    return username != null && !username.isBlank() && password != null && !password.isBlank();
  }

  /** Returns true when an ingest pipeline name is configured. */
  public boolean hasPipeline() {
    return pipeline != null && !pipeline.isBlank();
  }
}
