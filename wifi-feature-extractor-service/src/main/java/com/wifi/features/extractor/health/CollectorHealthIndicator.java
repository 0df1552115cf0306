// wifi-feature-extractor-service/src/main/java/com/wifi/features/extractor/health/CollectorHealthIndicator.java
package com.wifi.features.extractor.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.wifi.features.extractor.config.properties.PollingConfigurationProperties;
import com.wifi.features.extractor.dto.CycleResult;
import com.wifi.features.extractor.scheduler.PollingScheduler;
import com.wifi.features.extractor.scheduler.SchedulerState;
import com.wifi.features.extractor.service.CollectionMetricsService;

/**
 * Reports the state of the polling loop and the outcome of the most recent collection cycle.
 *
 * <p>A failed cycle does not mark the service DOWN; Kismet or Elasticsearch outages are expected to
 * be transient and the next cycle retries. The indicator is DOWN only when polling is enabled but
 * the loop is no longer running.
 */
@Component("collector")
public class CollectorHealthIndicator implements HealthIndicator {

  private static final Logger logger = LoggerFactory.getLogger(CollectorHealthIndicator.class);

  private final PollingScheduler pollingScheduler;
  private final CollectionMetricsService metricsService;
  private final PollingConfigurationProperties pollingConfig;

  public CollectorHealthIndicator(
      PollingScheduler pollingScheduler,
      CollectionMetricsService metricsService,
      PollingConfigurationProperties pollingConfig) {
    this.pollingScheduler = pollingScheduler;
    this.metricsService = metricsService;
    this.pollingConfig = pollingConfig;
  }

  @Override
  public Health health() {
    SchedulerState state = pollingScheduler.getState();
    boolean loopLost = pollingConfig.enabled() && state == SchedulerState.STOPPED;

    Health.Builder builder = loopLost ? Health.down() : Health.up();
    builder
        .withDetail("pollingEnabled", pollingConfig.enabled())
        .withDetail("schedulerState", state.name())
        .withDetail("intervalSeconds", pollingConfig.intervalSeconds());

    CycleResult lastCycle = metricsService.getLastCycle();
    if (lastCycle == null) {
      builder.withDetail("lastCycle", "none");
    } else {
      builder
          .withDetail("lastCycleId", lastCycle.cycleId())
          .withDetail("lastCycleStatus", lastCycle.status().name())
          .withDetail("lastCycleStart", lastCycle.cycleStart().toString())
          .withDetail("lastCycleDevicesFetched", lastCycle.devicesFetched())
          .withDetail("lastCycleRecordsIndexed", lastCycle.recordsIndexed())
          .withDetail("lastCycleRecordsFailed", lastCycle.recordsFailed());
      if (lastCycle.failureReason() != null) {
        builder.withDetail("lastCycleFailure", lastCycle.failureReason());
      }
    }

    if (loopLost) {
      logger.warn("Collector health DOWN: polling loop is not running");
    }
    return builder.build();
  }
}
