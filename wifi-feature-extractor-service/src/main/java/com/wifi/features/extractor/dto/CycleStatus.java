package com.wifi.features.extractor.dto;

/**
 * Outcome of one poll-transform-deliver cycle.
 */
public enum CycleStatus {
    /** Every built record was indexed. */
    SUCCESS,
    /** The fetch succeeded but no device qualified; the sink was not called. */
    NO_RECORDS,
    /** The device inventory could not be fetched; nothing was delivered. */
    FETCH_FAILED,
    /** The bulk write indexed some records and rejected others. */
    PARTIALLY_DELIVERED,
    /** The bulk write failed as a whole. */
    DELIVERY_FAILED;

    /** Returns true for outcomes that need operator attention. */
    public boolean isFailure() {
        return this == FETCH_FAILED || this == DELIVERY_FAILED || this == PARTIALLY_DELIVERED;
    }
}
