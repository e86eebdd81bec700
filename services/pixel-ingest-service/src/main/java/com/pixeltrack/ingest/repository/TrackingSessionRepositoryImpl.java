package com.pixeltrack.ingest.repository;

import com.pixeltrack.ingest.entity.TrackingSession;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

@RequiredArgsConstructor
public class TrackingSessionRepositoryImpl implements TrackingSessionUpsertRepository {

    private static final String MERGE_SQL = """
        INSERT INTO pixel_sessions (session_id, client_id, started_at, first_page, last_page)
        VALUES (:sessionId, :clientId, :startedAt, :firstPage, :lastPage)
        ON CONFLICT (session_id) DO UPDATE SET
            client_id = EXCLUDED.client_id,
            first_page = COALESCE(pixel_sessions.first_page, EXCLUDED.first_page),
            last_page = COALESCE(EXCLUDED.last_page, pixel_sessions.last_page)
        """;

    private static final String TOUCH_OWNER_SQL = """
        INSERT INTO pixel_sessions (session_id, client_id, started_at)
        VALUES (:sessionId, :clientId, :startedAt)
        ON CONFLICT (session_id) DO UPDATE SET
            client_id = EXCLUDED.client_id
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public void merge(TrackingSession incoming) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sessionId", incoming.getSessionId(), Types.VARCHAR)
            .addValue("clientId", incoming.getClientId(), Types.VARCHAR)
            .addValue("startedAt", utc(incoming.getStartedAt()), Types.TIMESTAMP_WITH_TIMEZONE)
            .addValue("firstPage", incoming.getFirstPage(), Types.VARCHAR)
            .addValue("lastPage", incoming.getLastPage(), Types.VARCHAR);
        jdbcTemplate.update(MERGE_SQL, params);
    }

    @Override
    public void touchOwner(String sessionId, String clientId, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sessionId", sessionId, Types.VARCHAR)
            .addValue("clientId", clientId, Types.VARCHAR)
            .addValue("startedAt", utc(startedAt), Types.TIMESTAMP_WITH_TIMEZONE);
        jdbcTemplate.update(TOUCH_OWNER_SQL, params);
    }

    private static OffsetDateTime utc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }
}
