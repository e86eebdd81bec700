package com.pixeltrack.ingest.model;

/**
 * Outcome of a bulk submission. Per-item failures are only visible as a lower count.
 *
 * @param ingested       items that passed validation and dedupe and are committed
 * @param storageFailed  true when the batch transaction rolled back
 */
public record BatchIngestionResult(int ingested, boolean storageFailed) {

    public static BatchIngestionResult ingested(int count) {
        return new BatchIngestionResult(count, false);
    }

    public static BatchIngestionResult storageFailure() {
        return new BatchIngestionResult(0, true);
    }
}
