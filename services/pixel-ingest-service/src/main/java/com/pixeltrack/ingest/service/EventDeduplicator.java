package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.dto.PixelEventRequest;

/**
 * Decides whether an event is a resubmission of one seen within the dedupe window.
 */
public interface EventDeduplicator {

    /**
     * Returns true and remembers the event's fingerprint when it has not been
     * seen within the window; returns false for a duplicate.
     */
    boolean shouldStore(PixelEventRequest event);

    /**
     * Number of fingerprints currently remembered, expired ones included until
     * the next check sweeps them.
     */
    int size();

    void clear();
}
