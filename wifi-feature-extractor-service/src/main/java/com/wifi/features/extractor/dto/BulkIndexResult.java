package com.wifi.features.extractor.dto;

/**
 * Result of a bulk write against the index store.
 *
 * @param indexed number of documents the store accepted
 * @param failed number of documents the store rejected
 * @param tookMillis server-side processing time reported by the store
 */
public record BulkIndexResult(int indexed, int failed, long tookMillis) {

  /** Result of a bulk call that had nothing to send. */
  public static BulkIndexResult empty() {
    return new BulkIndexResult(0, 0, 0L);
  }
}
