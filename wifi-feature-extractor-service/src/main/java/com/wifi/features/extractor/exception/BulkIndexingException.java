package com.wifi.features.extractor.exception;

/**
 * Exception thrown when a bulk write to the index store fails in whole or in part.
 *
 * <p>A partial failure means the store accepted some documents of the batch and rejected others;
 * {@link #getIndexedCount()} and {@link #getFailedCount()} tell how many.
 */
public class BulkIndexingException extends RuntimeException {

    private final boolean partial;
    private final int indexedCount;
    private final int failedCount;

    public BulkIndexingException(String message, int failedCount, Throwable cause) {
        super(message, cause);
        this.partial = false;
        this.indexedCount = 0;
        this.failedCount = failedCount;
    }

    public BulkIndexingException(String message, int indexedCount, int failedCount) {
        super(message);
        this.partial = indexedCount > 0;
        this.indexedCount = indexedCount;
        this.failedCount = failedCount;
    }

    /** Returns true if part of the batch was indexed. */
    public boolean isPartial() {
        return partial;
    }

    public int getIndexedCount() {
        return indexedCount;
    }

    public int getFailedCount() {
        return failedCount;
    }
}
