package com.pixeltrack.ingest.dto;

import com.pixeltrack.ingest.model.ValidationCode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 400 body for an event that failed validation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InvalidEventResponse {

    public static final String INVALID_EVENT = "invalid_event";

    private String error;
    private List<ValidationCode> errs;
    private List<ValidationCode> warns;

    public static InvalidEventResponse of(List<ValidationCode> errors, List<ValidationCode> warnings) {
        return new InvalidEventResponse(INVALID_EVENT, errors, warnings);
    }
}
