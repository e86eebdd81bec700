package com.pixeltrack.ingest.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Tracked visitor, keyed by the pixel's client id.
 *
 * Rows are only written through the upsert statements in
 * {@code ClientIdentityRepositoryImpl}: {@code userId}, {@code emailSha256} and
 * {@code phoneSha256} are coalesced there and never reset to null.
 */
@Entity
@Table(name = "pixel_users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "clientId")
public class ClientIdentity {

    @Id
    @Column(name = "client_id", length = 255)
    private String clientId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "traits", columnDefinition = "jsonb")
    private Map<String, Object> traits;

    @Column(name = "last_seen")
    private Instant lastSeen;

    @Column(name = "user_id", length = 255)
    private String userId;

    @Column(name = "email_sha256", length = 64)
    private String emailSha256;

    @Column(name = "phone_sha256", length = 64)
    private String phoneSha256;
}
