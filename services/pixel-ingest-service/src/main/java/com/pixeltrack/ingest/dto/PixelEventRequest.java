package com.pixeltrack.ingest.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Inbound tracking pixel event.
 *
 * Field names on the wire are snake_case. Unknown fields are ignored here but
 * survive in {@link #rawPayload}, which holds the untouched inbound object.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PixelEventRequest {

    // Identity
    private String eventId;
    private String eventName;
    private String clientId;
    private String sessionId;
    private Identify identify;
    private Map<String, Object> traits;

    // Time
    private Long timestamp;
    private String occurredAt;
    private String startedAt;

    // Page
    private String pageLocation;
    private String pageReferrer;
    private String pageTitle;
    private String userAgent;
    private String language;
    private Double timezoneOffset;
    private String message;

    // Structured blobs
    private Map<String, Object> viewport;
    private Map<String, Object> screen;
    private Map<String, Object> network;
    private Map<String, Object> performance;
    private Map<String, Object> campaign;
    private Map<String, Object> attribution;
    private Object referrerChain;
    private Map<String, Object> navigation;
    private Map<String, Object> click;
    private Map<String, Object> form;
    private Map<String, Object> engagement;
    private Map<String, Object> ecommerce;
    private Map<String, Object> browserHints;
    private Map<String, Object> experiment;

    // Legacy flat attribution
    private String utmSource;
    private String utmMedium;
    private String utmCampaign;
    private String utmContent;
    private String utmTerm;
    private String gclid;
    private String fbclid;
    private String wbraid;
    private String gbraid;
    private String msclkid;
    private String ttclid;
    private String yclid;

    // Meta pixel cookies
    private String fbp;
    private String fbc;

    // Client-side SDK validation, stored as reported
    private List<Object> validationWarnings;
    private List<Object> validationErrors;

    private Double botScore;

    @JsonIgnore
    private Map<String, Object> rawPayload;

    /**
     * Resolved identity the pixel attaches once the visitor is known.
     * Email and phone arrive already SHA-256 hashed.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Identify {
        private String userId;
        private String emailSha256;
        private String phoneSha256;
    }
}
