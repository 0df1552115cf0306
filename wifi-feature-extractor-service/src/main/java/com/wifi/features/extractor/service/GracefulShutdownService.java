// wifi-feature-extractor-service/src/main/java/com/wifi/features/extractor/service/GracefulShutdownService.java
package com.wifi.features.extractor.service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import com.wifi.features.extractor.config.properties.PollingConfigurationProperties;
import com.wifi.features.extractor.scheduler.PollingScheduler;

import jakarta.annotation.PreDestroy;

/**
 * Stops the polling loop when the application shuts down.
 *
 * <p><strong>Shutdown Sequence:</strong>
 *
 * <ol>
 *   <li>Stop scheduling new cycles
 *   <li>Wait for an in-flight cycle to finish, up to the configured shutdown timeout
 *   <li>Log the final collection metrics
 * </ol>
 *
 * <p>A cycle still running when the timeout passes is interrupted; its records are not delivered.
 */
@Service
public class GracefulShutdownService {

  private static final Logger logger = LoggerFactory.getLogger(GracefulShutdownService.class);

  private final PollingScheduler pollingScheduler;
  private final CollectionMetricsService metricsService;
  private final Duration shutdownTimeout;

  private final AtomicBoolean shutdownInProgress = new AtomicBoolean(false);

  public GracefulShutdownService(
      PollingScheduler pollingScheduler,
      CollectionMetricsService metricsService,
      PollingConfigurationProperties pollingConfig) {
    this.pollingScheduler = pollingScheduler;
    this.metricsService = metricsService;
    this.shutdownTimeout = Duration.ofSeconds(pollingConfig.shutdownTimeoutSeconds());
  }

  /** Handles Spring context closure event for graceful shutdown. */
  @EventListener
  public void onContextClosed(ContextClosedEvent event) {
    logger.info("Context closed event received, initiating graceful shutdown");
    initiateGracefulShutdown();
  }

  @PreDestroy
  public void preDestroy() {
    initiateGracefulShutdown();
  }

  /** Initiates the graceful shutdown process. Later calls are ignored. */
  public void initiateGracefulShutdown() {
    if (!shutdownInProgress.compareAndSet(false, true)) {
      logger.debug("Graceful shutdown already in progress, ignoring duplicate request");
      return;
    }

    Instant shutdownStart = Instant.now();
    logger.info("Starting graceful shutdown process...");

    try {
      pollingScheduler.stop();
      boolean terminated = pollingScheduler.awaitTermination(shutdownTimeout);

      Duration shutdownDuration = Duration.between(shutdownStart, Instant.now());
      if (terminated) {
        logger.info(
            "Graceful shutdown completed successfully in {}ms", shutdownDuration.toMillis());
      } else {
        logger.warn(
            "Polling loop did not finish within {}s, in-flight cycle abandoned",
            shutdownTimeout.toSeconds());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while waiting for the polling loop to finish");
    } finally {
      logger.info("Shutdown metrics: {}", metricsService.getMetricsSummary());
    }
  }

  /** Checks if graceful shutdown is in progress. */
  public boolean isShutdownInProgress() {
    return shutdownInProgress.get();
  }
}
