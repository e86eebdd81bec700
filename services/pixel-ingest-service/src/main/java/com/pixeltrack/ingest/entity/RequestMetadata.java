package com.pixeltrack.ingest.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Transport facts for one accepted request.
 *
 * A single-event request references the stored {@link PixelEvent#getId()}. A
 * bulk request writes one row for the whole batch that references
 * {@link #BATCH_EVENT_REFERENCE} instead; there is no foreign key.
 *
 * @author PixelTrack Platform Team
 * @since 1.0.0
 */
@Entity
@Table(name = "pixel_metadata", indexes = {
    @Index(name = "idx_pixel_metadata_event", columnList = "pixel_event_id"),
    @Index(name = "idx_pixel_metadata_request_id", columnList = "request_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"headers"})
@EqualsAndHashCode(of = "id")
public class RequestMetadata {

    /**
     * Event reference used by batch-level rows.
     */
    public static final long BATCH_EVENT_REFERENCE = 0L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pixel_event_id", nullable = false)
    private Long pixelEventId;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "headers", columnDefinition = "jsonb")
    private Map<String, String> headers;

    /**
     * Reserved for geo-IP enrichment, always null for now.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "geo_location", columnDefinition = "jsonb")
    private Map<String, Object> geoLocation;

    @Column(name = "user_agent", columnDefinition = "TEXT")
    private String userAgent;

    @Column(name = "request_id", length = 255)
    private String requestId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isBatchLevel() {
        return pixelEventId != null && pixelEventId == BATCH_EVENT_REFERENCE;
    }
}
