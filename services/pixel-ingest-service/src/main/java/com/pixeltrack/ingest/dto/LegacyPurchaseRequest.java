package com.pixeltrack.ingest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Body of the legacy {@code POST /purchases} endpoint, kept for pixels that
 * predate the {@code purchase} event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegacyPurchaseRequest {

    private String clientId;
    private String sessionId;
    private String purchaseId;
    private BigDecimal value;
    private String currency;
    private List<Object> items;
    private Long timestamp;
}
