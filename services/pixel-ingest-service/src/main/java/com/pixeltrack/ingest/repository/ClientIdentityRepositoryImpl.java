package com.pixeltrack.ingest.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pixeltrack.ingest.entity.ClientIdentity;
import com.pixeltrack.ingest.exception.PixelIngestException;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * PostgreSQL {@code ON CONFLICT} upserts for client identities. Runs on the
 * JDBC connection of the surrounding transaction.
 */
@RequiredArgsConstructor
public class ClientIdentityRepositoryImpl implements ClientIdentityUpsertRepository {

    private static final String MERGE_FROM_EVENT_SQL = """
        INSERT INTO pixel_users (client_id, traits, last_seen, user_id, email_sha256, phone_sha256)
        VALUES (:clientId, COALESCE(CAST(:traits AS jsonb), CAST('{}' AS jsonb)), :lastSeen,
                :userId, :emailSha256, :phoneSha256)
        ON CONFLICT (client_id) DO UPDATE SET
            last_seen = EXCLUDED.last_seen,
            traits = COALESCE(CAST(:traits AS jsonb), pixel_users.traits),
            user_id = COALESCE(EXCLUDED.user_id, pixel_users.user_id),
            email_sha256 = COALESCE(EXCLUDED.email_sha256, pixel_users.email_sha256),
            phone_sha256 = COALESCE(EXCLUDED.phone_sha256, pixel_users.phone_sha256)
        """;

    private static final String TOUCH_LAST_SEEN_SQL = """
        INSERT INTO pixel_users (client_id, traits, last_seen)
        VALUES (:clientId, CAST('{}' AS jsonb), :lastSeen)
        ON CONFLICT (client_id) DO UPDATE SET
            last_seen = EXCLUDED.last_seen
        """;

    private static final String REPLACE_TRAITS_SQL = """
        INSERT INTO pixel_users (client_id, traits, last_seen, user_id, email_sha256, phone_sha256)
        VALUES (:clientId, COALESCE(CAST(:traits AS jsonb), CAST('{}' AS jsonb)), :lastSeen,
                :userId, :emailSha256, :phoneSha256)
        ON CONFLICT (client_id) DO UPDATE SET
            traits = EXCLUDED.traits,
            last_seen = EXCLUDED.last_seen,
            user_id = COALESCE(EXCLUDED.user_id, pixel_users.user_id),
            email_sha256 = COALESCE(EXCLUDED.email_sha256, pixel_users.email_sha256),
            phone_sha256 = COALESCE(EXCLUDED.phone_sha256, pixel_users.phone_sha256)
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void mergeFromEvent(ClientIdentity incoming) {
        jdbcTemplate.update(MERGE_FROM_EVENT_SQL, identityParameters(incoming));
    }

    @Override
    public void touchLastSeen(String clientId, Instant lastSeen) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("clientId", clientId, Types.VARCHAR)
            .addValue("lastSeen", utc(lastSeen), Types.TIMESTAMP_WITH_TIMEZONE);
        jdbcTemplate.update(TOUCH_LAST_SEEN_SQL, params);
    }

    @Override
    public void replaceTraitsAndMerge(ClientIdentity incoming) {
        jdbcTemplate.update(REPLACE_TRAITS_SQL, identityParameters(incoming));
    }

    private MapSqlParameterSource identityParameters(ClientIdentity incoming) {
        return new MapSqlParameterSource()
            .addValue("clientId", incoming.getClientId(), Types.VARCHAR)
            .addValue("traits", toJson(incoming.getTraits()), Types.VARCHAR)
            .addValue("lastSeen", utc(incoming.getLastSeen()), Types.TIMESTAMP_WITH_TIMEZONE)
            .addValue("userId", incoming.getUserId(), Types.VARCHAR)
            .addValue("emailSha256", incoming.getEmailSha256(), Types.VARCHAR)
            .addValue("phoneSha256", incoming.getPhoneSha256(), Types.VARCHAR);
    }

    private String toJson(Map<String, Object> traits) {
        if (traits == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(traits);
        } catch (JsonProcessingException e) {
            throw new PixelIngestException("Unable to serialize client traits", e);
        }
    }

    private static OffsetDateTime utc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }
}
