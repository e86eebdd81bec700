package com.pixeltrack.ingest.model;

import com.pixeltrack.ingest.dto.PixelEventRequest;

/**
 * Deduplication key. Payload content is deliberately not part of it.
 */
public record EventFingerprint(String eventName, String eventId) {

    public static EventFingerprint of(PixelEventRequest event) {
        return new EventFingerprint(event.getEventName(), event.getEventId());
    }
}
