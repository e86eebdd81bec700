package com.pixeltrack.ingest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of {@code POST /users}. Traits replace the stored traits wholesale.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClientIdentityUpsertRequest {

    @NotBlank(message = "client_id is required")
    @Size(max = 255)
    private String clientId;

    private Map<String, Object> traits;

    /**
     * ISO-8601 or epoch milliseconds; defaults to now.
     */
    private String lastSeen;

    private String userId;

    @Size(max = 64)
    private String emailSha256;

    @Size(max = 64)
    private String phoneSha256;
}
