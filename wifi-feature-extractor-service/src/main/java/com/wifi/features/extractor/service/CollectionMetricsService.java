// wifi-feature-extractor-service/src/main/java/com/wifi/features/extractor/service/CollectionMetricsService.java
package com.wifi.features.extractor.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import com.wifi.features.extractor.dto.CycleResult;
import com.wifi.features.extractor.dto.CycleStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Metrics service for tracking collection cycles, record extraction and bulk indexing.
 * 
 * <p><strong>Metric Categories:</strong></p>
 * <ul>
 *   <li><strong>Cycles:</strong> cycles run per outcome and their duration</li>
 *   <li><strong>Records:</strong> devices fetched, feature records built, devices skipped</li>
 *   <li><strong>Indexing:</strong> documents indexed and rejected, batch sizes</li>
 * </ul>
 */
@Service
public class CollectionMetricsService {

    // Cycle Metrics
    private final Map<CycleStatus, Counter> cycleCounters = new EnumMap<>(CycleStatus.class);
    private final Timer cycleDurationTimer;

    // Record Metrics
    private final Counter devicesFetchedCounter;
    private final Counter recordsBuiltCounter;
    private final Counter recordsSkippedCounter;

    // Indexing Metrics
    private final Counter documentsIndexedCounter;
    private final Counter documentsFailedCounter;
    private final DistributionSummary batchSizeDistribution;

    private final AtomicReference<Instant> lastSuccessfulCycle = new AtomicReference<>();
    private final AtomicReference<CycleResult> lastCycle = new AtomicReference<>();

    public CollectionMetricsService(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            throw new IllegalArgumentException("MeterRegistry cannot be null");
        }

        for (CycleStatus status : CycleStatus.values()) {
            cycleCounters.put(status, Counter.builder("collector.cycles.total")
                .description("Total number of collection cycles by outcome")
                .tag("status", status.name().toLowerCase())
                .register(meterRegistry));
        }

        this.cycleDurationTimer = Timer.builder("collector.cycle.duration")
            .description("Time taken by one poll-transform-deliver cycle")
            .register(meterRegistry);

        this.devicesFetchedCounter = Counter.builder("collector.devices.fetched.total")
            .description("Total number of device records fetched from Kismet")
            .register(meterRegistry);

        this.recordsBuiltCounter = Counter.builder("collector.records.built.total")
            .description("Total number of feature records built")
            .register(meterRegistry);

        this.recordsSkippedCounter = Counter.builder("collector.records.skipped.total")
            .description("Total number of device records dropped before indexing")
            .register(meterRegistry);

        this.documentsIndexedCounter = Counter.builder("collector.documents.indexed.total")
            .description("Total number of documents accepted by Elasticsearch")
            .register(meterRegistry);

        this.documentsFailedCounter = Counter.builder("collector.documents.failed.total")
            .description("Total number of documents rejected by Elasticsearch")
            .register(meterRegistry);

        this.batchSizeDistribution = DistributionSummary.builder("collector.batch.size.records")
            .description("Distribution of bulk request sizes in number of documents")
            .register(meterRegistry);

        Gauge.builder("collector.last.success.age.seconds", this, service -> {
                Instant last = service.lastSuccessfulCycle.get();
                return last != null ? Duration.between(last, Instant.now()).getSeconds() : -1;
            })
            .description("Seconds since the last fully delivered cycle")
            .register(meterRegistry);
    }

    /** Records the outcome and counters of a finished cycle. */
    public void recordCycle(CycleResult result) {
        lastCycle.set(result);
        cycleCounters.get(result.status()).increment();
        if (result.duration() != null) {
            cycleDurationTimer.record(result.duration());
        }
        devicesFetchedCounter.increment(result.devicesFetched());
        recordsBuiltCounter.increment(result.recordsBuilt());
        recordsSkippedCounter.increment(result.recordsSkipped());
        documentsIndexedCounter.increment(result.recordsIndexed());
        documentsFailedCounter.increment(result.recordsFailed());
        if (result.recordsBuilt() > 0) {
            batchSizeDistribution.record(result.recordsBuilt());
        }
        if (result.status() == CycleStatus.SUCCESS || result.status() == CycleStatus.NO_RECORDS) {
            lastSuccessfulCycle.set(Instant.now());
        }
    }

    public double getCycleCount(CycleStatus status) {
        return cycleCounters.get(status).count();
    }

    /** Returns the most recent cycle, or null before the first cycle finished. */
    public CycleResult getLastCycle() {
        return lastCycle.get();
    }

    public double getDocumentsIndexed() {
        return documentsIndexedCounter.count();
    }

    public String getMetricsSummary() {
        return String.format(
            "Collection Metrics Summary: " +
            "Cycles[Success: %.0f, Empty: %.0f, Fetch Failed: %.0f, Partial: %.0f, Delivery Failed: %.0f] " +
            "Records[Fetched: %.0f, Built: %.0f, Skipped: %.0f] " +
            "Elasticsearch[Indexed: %.0f, Rejected: %.0f]",
            getCycleCount(CycleStatus.SUCCESS),
            getCycleCount(CycleStatus.NO_RECORDS),
            getCycleCount(CycleStatus.FETCH_FAILED),
            getCycleCount(CycleStatus.PARTIALLY_DELIVERED),
            getCycleCount(CycleStatus.DELIVERY_FAILED),
            devicesFetchedCounter.count(),
            recordsBuiltCounter.count(),
            recordsSkippedCounter.count(),
            documentsIndexedCounter.count(),
            documentsFailedCounter.count()
        );
    }
}
