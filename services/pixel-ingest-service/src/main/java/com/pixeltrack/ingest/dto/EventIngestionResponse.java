package com.pixeltrack.ingest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pixeltrack.ingest.model.ValidationCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Success body for a single event: either {@code {"ok":true,"id":..,"warns":[..]}}
 * or {@code {"ok":true,"deduped":true}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventIngestionResponse {

    private boolean ok;
    private Long id;
    private List<ValidationCode> warns;
    private Boolean deduped;

    public static EventIngestionResponse stored(Long id, List<ValidationCode> warnings) {
        return EventIngestionResponse.builder().ok(true).id(id).warns(warnings).build();
    }

    public static EventIngestionResponse deduplicated() {
        return EventIngestionResponse.builder().ok(true).deduped(true).build();
    }
}
