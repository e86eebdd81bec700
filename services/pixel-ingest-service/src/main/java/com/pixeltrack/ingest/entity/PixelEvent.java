package com.pixeltrack.ingest.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Stored tracking pixel event.
 *
 * Rows are written once by the ingestion pipeline and never updated. The
 * caller-supplied {@code eventId} is not unique across time; {@link #id} is the
 * database key returned to the pixel and referenced by {@link RequestMetadata}.
 *
 * @author PixelTrack Platform Team
 * @since 1.0.0
 */
@Entity
@Table(name = "pixel_events", indexes = {
    @Index(name = "idx_pixel_events_fingerprint", columnList = "event_name, event_id"),
    @Index(name = "idx_pixel_events_client_id", columnList = "client_id"),
    @Index(name = "idx_pixel_events_session_id", columnList = "session_id"),
    @Index(name = "idx_pixel_events_occurred_at", columnList = "occurred_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"rawPayload"})
@EqualsAndHashCode(of = "id")
public class PixelEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, length = 255)
    private String eventId;

    @Column(name = "event_name", nullable = false, length = 255)
    private String eventName;

    /**
     * Epoch milliseconds as reported by the pixel, or derived from {@link #occurredAt}.
     */
    @Column(name = "\"timestamp\"")
    private Long epochMillis;

    @Column(name = "client_id", nullable = false, length = 255)
    private String clientId;

    @Column(name = "session_id", length = 255)
    private String sessionId;

    @Column(name = "page_location", columnDefinition = "TEXT")
    private String pageLocation;

    @Column(name = "page_referrer", columnDefinition = "TEXT")
    private String pageReferrer;

    @Column(name = "user_agent", columnDefinition = "TEXT")
    private String userAgent;

    @Column(name = "viewport_width")
    private Integer viewportWidth;

    @Column(name = "viewport_height")
    private Integer viewportHeight;

    @Column(name = "utm_source")
    private String utmSource;

    @Column(name = "utm_medium")
    private String utmMedium;

    @Column(name = "utm_campaign")
    private String utmCampaign;

    @Column(name = "utm_content")
    private String utmContent;

    @Column(name = "utm_term")
    private String utmTerm;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "page_title", columnDefinition = "TEXT")
    private String pageTitle;

    @Column(name = "language", length = 64)
    private String language;

    @Column(name = "timezone_offset")
    private Double timezoneOffset;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "screen", columnDefinition = "jsonb")
    private Map<String, Object> screen;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "viewport", columnDefinition = "jsonb")
    private Map<String, Object> viewport;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "network", columnDefinition = "jsonb")
    private Map<String, Object> network;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "performance", columnDefinition = "jsonb")
    private Map<String, Object> performance;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "campaign", columnDefinition = "jsonb")
    private Map<String, Object> campaign;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "attribution", columnDefinition = "jsonb")
    private Map<String, Object> attribution;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "referrer_chain", columnDefinition = "jsonb")
    private List<Object> referrerChain;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "navigation", columnDefinition = "jsonb")
    private Map<String, Object> navigation;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "click", columnDefinition = "jsonb")
    private Map<String, Object> click;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "form", columnDefinition = "jsonb")
    private Map<String, Object> form;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "engagement", columnDefinition = "jsonb")
    private Map<String, Object> engagement;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "ecommerce", columnDefinition = "jsonb")
    private Map<String, Object> ecommerce;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "browser_hints", columnDefinition = "jsonb")
    private Map<String, Object> browserHints;

    @Column(name = "fbp")
    private String fbp;

    @Column(name = "fbc")
    private String fbc;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "validation_warnings", columnDefinition = "jsonb")
    private List<Object> validationWarnings;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "validation_errors", columnDefinition = "jsonb")
    private List<Object> validationErrors;

    @Column(name = "bot_score", nullable = false)
    @Builder.Default
    private Double botScore = 0d;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "experiment", columnDefinition = "jsonb")
    private Map<String, Object> experiment;

    /**
     * The complete inbound object, unknown fields included.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_payload", columnDefinition = "jsonb")
    private Map<String, Object> rawPayload;

    @CreationTimestamp
    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;
}
