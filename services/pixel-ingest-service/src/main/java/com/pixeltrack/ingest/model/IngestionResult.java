package com.pixeltrack.ingest.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Outcome of the single-event pipeline. The controller alone maps it to HTTP.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IngestionResult {

    public enum Status {
        STORED,
        DEDUPLICATED,
        REJECTED,
        STORAGE_FAILED
    }

    Status status;

    /**
     * Database id of the stored row, set only when {@link Status#STORED}.
     */
    Long eventDbId;

    List<ValidationCode> errors;

    List<ValidationCode> warnings;

    public static IngestionResult stored(Long eventDbId, List<ValidationCode> warnings) {
        return new IngestionResult(Status.STORED, eventDbId, List.of(), List.copyOf(warnings));
    }

    public static IngestionResult deduplicated() {
        return new IngestionResult(Status.DEDUPLICATED, null, List.of(), List.of());
    }

    public static IngestionResult rejected(ValidationResult validation) {
        return new IngestionResult(Status.REJECTED, null, validation.errors(), validation.warnings());
    }

    public static IngestionResult storageFailed() {
        return new IngestionResult(Status.STORAGE_FAILED, null, List.of(), List.of());
    }
}
