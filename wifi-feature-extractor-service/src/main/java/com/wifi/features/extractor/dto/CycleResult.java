package com.wifi.features.extractor.dto;

import java.time.Duration;
import java.time.Instant;

/**
 * Summary of one collection cycle, used for logging, metrics and tests.
 *
 * @param cycleId correlation id of the cycle
 * @param status the cycle outcome
 * @param cycleStart instant the cycle started, also the fallback document timestamp
 * @param devicesFetched number of device records returned by Kismet
 * @param recordsBuilt number of feature records built
 * @param recordsSkipped number of device records dropped
 * @param recordsIndexed number of records the index store accepted
 * @param recordsFailed number of records the index store rejected
 * @param failureReason description of the failure, null on success
 * @param duration wall-clock duration of the cycle
 */
public record CycleResult(
    String cycleId,
    CycleStatus status,
    Instant cycleStart,
    int devicesFetched,
    int recordsBuilt,
    int recordsSkipped,
    int recordsIndexed,
    int recordsFailed,
    String failureReason,
    Duration duration) {

  public static CycleResult fetchFailed(
      String cycleId, Instant cycleStart, String reason, Duration duration) {
    return new CycleResult(
        cycleId, CycleStatus.FETCH_FAILED, cycleStart, 0, 0, 0, 0, 0, reason, duration);
  }

  public static CycleResult noRecords(
      String cycleId, Instant cycleStart, int devicesFetched, int recordsSkipped, Duration duration) {
    return new CycleResult(
        cycleId,
        CycleStatus.NO_RECORDS,
        cycleStart,
        devicesFetched,
        0,
        recordsSkipped,
        0,
        0,
        null,
        duration);
  }

  public static CycleResult delivered(
      String cycleId,
      Instant cycleStart,
      int devicesFetched,
      int recordsBuilt,
      int recordsSkipped,
      BulkIndexResult indexResult,
      Duration duration) {
    return new CycleResult(
        cycleId,
        CycleStatus.SUCCESS,
        cycleStart,
        devicesFetched,
        recordsBuilt,
        recordsSkipped,
        indexResult.indexed(),
        indexResult.failed(),
        null,
        duration);
  }

  public static CycleResult deliveryFailed(
      String cycleId,
      Instant cycleStart,
      int devicesFetched,
      int recordsBuilt,
      int recordsSkipped,
      boolean partial,
      int recordsIndexed,
      int recordsFailed,
      String reason,
      Duration duration) {
    return new CycleResult(
        cycleId,
        partial ? CycleStatus.PARTIALLY_DELIVERED : CycleStatus.DELIVERY_FAILED,
        cycleStart,
        devicesFetched,
        recordsBuilt,
        recordsSkipped,
        recordsIndexed,
        recordsFailed,
        reason,
        duration);
  }
}
