// wifi-feature-extractor-service/src/main/java/com/wifi/features/extractor/service/CollectionCycleService.java
package com.wifi.features.extractor.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.wifi.features.extractor.client.KismetDeviceClient;
import com.wifi.features.extractor.dto.BulkIndexResult;
import com.wifi.features.extractor.dto.CycleResult;
import com.wifi.features.extractor.dto.FeatureRecord;
import com.wifi.features.extractor.exception.BulkIndexingException;
import com.wifi.features.extractor.exception.DeviceSourceException;

/**
 * Runs one poll-transform-deliver cycle.
 *
 * <p><strong>Cycle Flow:</strong>
 *
 * <ol>
 *   <li>Capture the cycle timestamp
 *   <li>Fetch the devices Kismet saw during the configured window
 *   <li>Build one feature record per device, skipping devices without a hardware address
 *   <li>Deliver all records with a single bulk request
 * </ol>
 *
 * <p>No failure escapes this method: a fetch or delivery failure ends the cycle with the matching
 * {@link com.wifi.features.extractor.dto.CycleStatus} and the next cycle starts fresh. Records of a
 * failed cycle are dropped.
 */
@Service
public class CollectionCycleService {

  private static final Logger logger = LoggerFactory.getLogger(CollectionCycleService.class);
  static final String CYCLE_ID_KEY = "cycleId";

  private final KismetDeviceClient deviceClient;
  private final FeatureDocumentBuilder documentBuilder;
  private final ElasticsearchBulkIndexer bulkIndexer;
  private final CollectionMetricsService metricsService;
  private final Clock clock;

  public CollectionCycleService(
      KismetDeviceClient deviceClient,
      FeatureDocumentBuilder documentBuilder,
      ElasticsearchBulkIndexer bulkIndexer,
      CollectionMetricsService metricsService,
      Clock clock) {
    if (deviceClient == null) {
      throw new IllegalArgumentException("KismetDeviceClient cannot be null");
    }
    if (documentBuilder == null) {
      throw new IllegalArgumentException("FeatureDocumentBuilder cannot be null");
    }
    if (bulkIndexer == null) {
      throw new IllegalArgumentException("ElasticsearchBulkIndexer cannot be null");
    }
    if (metricsService == null) {
      throw new IllegalArgumentException("CollectionMetricsService cannot be null");
    }
    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }
    this.deviceClient = deviceClient;
    this.documentBuilder = documentBuilder;
    this.bulkIndexer = bulkIndexer;
    this.metricsService = metricsService;
    this.clock = clock;
  }

  /**
   * Executes a single cycle.
   *
   * @return the cycle outcome, never null
   */
  public CycleResult runCycle() {
    String cycleId = UUID.randomUUID().toString();
    Instant cycleStart = clock.instant();
    MDC.put(CYCLE_ID_KEY, cycleId);
    try {
      logger.info("Starting collection cycle at {}", cycleStart);
      CycleResult result = execute(cycleId, cycleStart);
      metricsService.recordCycle(result);
      logCompletion(result);
      return result;
    } finally {
      MDC.remove(CYCLE_ID_KEY);
    }
  }

  private CycleResult execute(String cycleId, Instant cycleStart) {
    List<JsonNode> devices;
    try {
      devices = deviceClient.fetchRecentDevices();
    } catch (DeviceSourceException e) {
      logger.error("Device fetch failed: {}", e.getMessage(), e);
      return CycleResult.fetchFailed(cycleId, cycleStart, e.getMessage(), elapsedSince(cycleStart));
    }

    List<FeatureRecord> records = new ArrayList<>(devices.size());
    int skipped = 0;
    for (JsonNode device : devices) {
      try {
        Optional<FeatureRecord> record = documentBuilder.build(device, cycleStart);
        if (record.isPresent()) {
          records.add(record.get());
        } else {
          skipped++;
        }
      } catch (RuntimeException e) {
        skipped++;
        logger.warn("Skipping device record that could not be transformed: {}", e.getMessage());
      }
    }

    if (skipped > 0) {
      logger.debug("Skipped {} of {} device records", skipped, devices.size());
    }

    if (records.isEmpty()) {
      logger.info("No feature records to index ({} devices fetched)", devices.size());
      return CycleResult.noRecords(
          cycleId, cycleStart, devices.size(), skipped, elapsedSince(cycleStart));
    }

    try {
      BulkIndexResult indexResult = bulkIndexer.index(records);
      return CycleResult.delivered(
          cycleId,
          cycleStart,
          devices.size(),
          records.size(),
          skipped,
          indexResult,
          elapsedSince(cycleStart));
    } catch (BulkIndexingException e) {
      if (e.isPartial()) {
        logger.warn(
            "Bulk indexing partially failed: {} indexed, {} rejected: {}",
            e.getIndexedCount(),
            e.getFailedCount(),
            e.getMessage());
      } else {
        logger.error("Bulk indexing failed: {}", e.getMessage(), e);
      }
      return CycleResult.deliveryFailed(
          cycleId,
          cycleStart,
          devices.size(),
          records.size(),
          skipped,
          e.isPartial(),
          e.getIndexedCount(),
          e.getFailedCount(),
          e.getMessage(),
          elapsedSince(cycleStart));
    }
  }

  private void logCompletion(CycleResult result) {
    if (result.status().isFailure()) {
      logger.warn(
          "Collection cycle finished with {} in {}ms: {} indexed, {} failed",
          result.status(),
          result.duration().toMillis(),
          result.recordsIndexed(),
          result.recordsFailed());
    } else {
      logger.info(
          "Collection cycle finished with {} in {}ms: {} indexed, {} skipped",
          result.status(),
          result.duration().toMillis(),
          result.recordsIndexed(),
          result.recordsSkipped());
    }
  }

  private Duration elapsedSince(Instant start) {
    Duration elapsed = Duration.between(start, clock.instant());
    return elapsed.isNegative() ? Duration.ZERO : elapsed;
  }
}
