package com.pixeltrack.ingest.repository;

import com.pixeltrack.ingest.entity.ClientIdentity;

import java.time.Instant;

/**
 * Insert-or-merge statements for {@code pixel_users}.
 *
 * All variants coalesce {@code user_id}, {@code email_sha256} and
 * {@code phone_sha256}: a null incoming value never erases a stored one.
 */
public interface ClientIdentityUpsertRepository {

    /**
     * Event-driven upsert. Refreshes last-seen, coalesces resolved identity and
     * replaces traits only when {@code incoming.getTraits()} is non-null.
     */
    void mergeFromEvent(ClientIdentity incoming);

    /**
     * Minimal upsert used by bulk ingestion: last-seen only.
     */
    void touchLastSeen(String clientId, Instant lastSeen);

    /**
     * Explicit upsert: traits and last-seen are overwritten, identity fields coalesced.
     */
    void replaceTraitsAndMerge(ClientIdentity incoming);
}
