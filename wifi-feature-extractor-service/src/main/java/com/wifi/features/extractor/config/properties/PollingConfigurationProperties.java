package com.wifi.features.extractor.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Configuration properties for the poll-transform-deliver loop.
 *
 * @param enabled whether the polling loop starts with the application
 * @param intervalSeconds pause after every cycle, whatever its outcome
 * @param shutdownTimeoutSeconds how long shutdown waits for an in-flight cycle
 */
@ConfigurationProperties(prefix = "collector.polling")
@Validated
public record PollingConfigurationProperties(
    boolean enabled,
    @Min(value = 1, message = "Poll interval must be at least 1 second")
        @Max(value = 3600, message = "Poll interval cannot exceed one hour")
        int intervalSeconds,
    @Min(value = 1, message = "Shutdown timeout must be at least 1 second")
        int shutdownTimeoutSeconds) {}
