package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.config.IngestionProperties;
import com.pixeltrack.ingest.dto.PixelEventRequest;
import com.pixeltrack.ingest.model.EventFingerprint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local dedupe cache. Not shared between instances and lost on restart.
 *
 * Every check first sweeps entries older than the window, so the map only
 * grows with the number of distinct fingerprints seen inside one window.
 */
@Slf4j
@Component
public class InMemoryEventDeduplicator implements EventDeduplicator {

    private final Map<EventFingerprint, Instant> seen = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final Duration window;

    public InMemoryEventDeduplicator(Clock clock, IngestionProperties properties) {
        this.clock = clock;
        this.window = properties.getDedupe().getWindow();
    }

    @Override
    public boolean shouldStore(PixelEventRequest event) {
        EventFingerprint fingerprint = EventFingerprint.of(event);
        Instant now = clock.instant();

        lock.lock();
        try {
            evictExpired(now);
            if (seen.containsKey(fingerprint)) {
                log.debug("Duplicate event suppressed: name={}, id={}",
                        fingerprint.eventName(), fingerprint.eventId());
                return false;
            }
            seen.put(fingerprint, now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return seen.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            seen.clear();
        } finally {
            lock.unlock();
        }
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(window);
        seen.values().removeIf(insertedAt -> insertedAt.isBefore(cutoff));
    }
}
