package com.pixeltrack.ingest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pixeltrack.ingest.dto.PixelEventRequest;
import com.pixeltrack.ingest.entity.PixelEvent;
import com.pixeltrack.ingest.metrics.IngestionMetricsService;
import com.pixeltrack.ingest.model.IngestionResult;
import com.pixeltrack.ingest.model.RequestContext;
import com.pixeltrack.ingest.model.ValidationResult;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.Optional;

/**
 * Single-event pipeline: read, validate, dedupe, normalize, upsert identity
 * and session, then write the event with its request metadata.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventIngestionService {

    private final PixelEventReader reader;
    private final PixelEventValidator validator;
    private final EventDeduplicator deduplicator;
    private final EventNormalizer normalizer;
    private final IdentityUpserter identityUpserter;
    private final EventWriter eventWriter;
    private final IngestionMetricsService metricsService;

    public IngestionResult ingest(JsonNode payload, RequestContext context) {
        metricsService.recordEventReceived();
        Timer.Sample sample = metricsService.startTimer();
        try {
            IngestionResult result = process(payload, context);
            metricsService.recordEventOutcome(result.getStatus());
            return result;
        } finally {
            metricsService.stopTimer(sample, "single");
        }
    }

    private IngestionResult process(JsonNode payload, RequestContext context) {
        Optional<PixelEventRequest> read = reader.read(payload);
        if (read.isEmpty()) {
            log.warn("Rejected malformed event payload: requestId={}", context.getRequestId());
            return IngestionResult.rejected(ValidationResult.malformed());
        }
        PixelEventRequest event = read.get();

        ValidationResult validation = validator.validate(event);
        if (validation.hasErrors()) {
            log.warn("Rejected invalid event: name={}, eventId={}, errors={}",
                    event.getEventName(), event.getEventId(), validation.errors());
            return IngestionResult.rejected(validation);
        }

        if (!deduplicator.shouldStore(event)) {
            return IngestionResult.deduplicated();
        }

        PixelEvent normalized = normalizer.normalize(event, context);
        try {
            identityUpserter.upsertIdentity(event);
            identityUpserter.upsertSession(event);
            Long id = eventWriter.writeEvent(normalized, context);
            return IngestionResult.stored(id, validation.warnings());
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to store event: name={}, eventId={}", event.getEventName(), event.getEventId(), e);
            return IngestionResult.storageFailed();
        }
    }
}
