package com.pixeltrack.ingest.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Browsing session reported by the pixel.
 *
 * {@code firstPage} is sticky: once set it is never replaced. {@code lastPage}
 * follows the most recent write that carried a page.
 */
@Entity
@Table(name = "pixel_sessions", indexes = {
    @Index(name = "idx_pixel_sessions_client_id", columnList = "client_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "sessionId")
public class TrackingSession {

    @Id
    @Column(name = "session_id", length = 255)
    private String sessionId;

    @Column(name = "client_id", length = 255)
    private String clientId;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "first_page", columnDefinition = "TEXT")
    private String firstPage;

    @Column(name = "last_page", columnDefinition = "TEXT")
    private String lastPage;
}
