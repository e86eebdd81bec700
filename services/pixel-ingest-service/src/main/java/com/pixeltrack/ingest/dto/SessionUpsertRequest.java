package com.pixeltrack.ingest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /sessions}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionUpsertRequest {

    @NotBlank(message = "session_id is required")
    @Size(max = 255)
    private String sessionId;

    @Size(max = 255)
    private String clientId;

    private String startedAt;

    private String firstPage;

    private String lastPage;
}
