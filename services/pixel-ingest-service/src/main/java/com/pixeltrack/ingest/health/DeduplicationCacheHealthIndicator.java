package com.pixeltrack.ingest.health;

import com.pixeltrack.ingest.config.IngestionProperties;
import com.pixeltrack.ingest.service.EventDeduplicator;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the in-memory dedupe cache as the {@code dedupeCache} health component.
 */
@Component("dedupeCache")
@RequiredArgsConstructor
public class DeduplicationCacheHealthIndicator implements HealthIndicator {

    private final EventDeduplicator deduplicator;
    private final IngestionProperties properties;

    @Override
    public Health health() {
        return Health.up()
                .withDetail("entries", deduplicator.size())
                .withDetail("window", properties.getDedupe().getWindow().toString())
                .build();
    }
}
