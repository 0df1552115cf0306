package com.wifi.features.extractor.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.wifi.features.extractor.adapter.FieldLayout;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the Kismet REST API that supplies the device inventory.
 *
 * <p>The collector asks Kismet for devices active within the last {@code windowSeconds} seconds
 * using the relative "last-time" endpoint.
 */
@ConfigurationProperties(prefix = "kismet")
@Validated
public record KismetConfigurationProperties(

    /** Base URL of the Kismet server, e.g. http://localhost:2501. */
    @NotBlank(message = "Kismet URL is required") String baseUrl,

    /** Relative activity window in seconds. */
    @Min(value = 1, message = "Kismet window must be at least 1 second")
        @Max(value = 86400, message = "Kismet window cannot exceed one day")
        int windowSeconds,

    /** Optional basic-auth user name. */
    String username,

    /** Optional basic-auth password. */
    String password,

    /** Field naming convention of device records; AUTO probes every record. */
    @NotNull(message = "Kismet field layout is required") FieldLayout fieldLayout,

    /** Connect timeout in milliseconds. */
    @Min(value = 100, message = "Connect timeout must be at least 100ms")
        @Max(value = 60000, message = "Connect timeout cannot exceed 60 seconds")
        int connectTimeoutMs,

    /** Upper bound for one device fetch, including reading the body. */
    @Positive(message = "Request timeout must be positive") long requestTimeoutMs,

    /** Largest response body accepted from Kismet, in bytes. */
    @Min(value = 65536, message = "Max response size must be at least 64KB")
        int maxResponseBytes) {

  /** Returns true when both user name and password are configured. */
  public boolean hasCredentials() {
    return username != null && !username.isBlank() && password != null && !password.isBlank();
  }
}
