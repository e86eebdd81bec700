package com.pixeltrack.ingest.repository;

import com.pixeltrack.ingest.entity.TrackingSession;

import java.time.Instant;

/**
 * Insert-or-merge statements for {@code pixel_sessions}.
 */
public interface TrackingSessionUpsertRepository {

    /**
     * Overwrites the owning client, keeps an existing first page, and replaces
     * the last page when {@code incoming.getLastPage()} is non-null.
     * {@code startedAt} is only used when the row is created.
     */
    void merge(TrackingSession incoming);

    /**
     * Minimal upsert used by bulk ingestion: owning client only.
     */
    void touchOwner(String sessionId, String clientId, Instant startedAt);
}
