package com.pixeltrack.ingest.model;

import java.util.List;

/**
 * Outcome of validating one event. Errors block storage, warnings do not.
 */
public record ValidationResult(List<ValidationCode> errors, List<ValidationCode> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult malformed() {
        return new ValidationResult(List.of(ValidationCode.INVALID_PAYLOAD), List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
