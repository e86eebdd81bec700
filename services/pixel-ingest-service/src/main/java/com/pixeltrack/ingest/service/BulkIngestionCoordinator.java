package com.pixeltrack.ingest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pixeltrack.ingest.dto.PixelEventRequest;
import com.pixeltrack.ingest.metrics.IngestionMetricsService;
import com.pixeltrack.ingest.model.BatchIngestionResult;
import com.pixeltrack.ingest.model.RequestContext;
import com.pixeltrack.ingest.model.ValidationResult;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Ingests a bulk submission in one transaction.
 *
 * <p>Items that are malformed, invalid or duplicate are skipped and only lower
 * the ingested count. A storage fault rolls back every insert of the batch.
 * Dedupe registrations made before the fault are kept, so resubmitting the
 * same batch inside the window stores nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkIngestionCoordinator {

    private final PixelEventReader reader;
    private final PixelEventValidator validator;
    private final EventDeduplicator deduplicator;
    private final EventNormalizer normalizer;
    private final IdentityUpserter identityUpserter;
    private final EventWriter eventWriter;
    private final TransactionTemplate transactionTemplate;
    private final IngestionMetricsService metricsService;

    public BatchIngestionResult ingestBatch(List<JsonNode> payloads, RequestContext context) {
        if (payloads.isEmpty()) {
            metricsService.recordBatch(0, 0, false);
            return BatchIngestionResult.ingested(0);
        }

        Timer.Sample sample = metricsService.startTimer();
        BatchIngestionResult result;
        try {
            Integer ingested = transactionTemplate.execute(status -> ingestItems(payloads, context));
            result = BatchIngestionResult.ingested(ingested == null ? 0 : ingested);
            log.info("Ingested batch: size={}, ingested={}, requestId={}",
                    payloads.size(), result.ingested(), context.getRequestId());
        } catch (DataAccessException | TransactionException e) {
            log.error("Batch rolled back: size={}, requestId={}", payloads.size(), context.getRequestId(), e);
            result = BatchIngestionResult.storageFailure();
        } finally {
            metricsService.stopTimer(sample, "batch");
        }

        metricsService.recordBatch(payloads.size(), result.ingested(), result.storageFailed());
        return result;
    }

    private int ingestItems(List<JsonNode> payloads, RequestContext context) {
        int ingested = 0;
        for (JsonNode payload : payloads) {
            Optional<PixelEventRequest> read = reader.read(payload);
            if (read.isEmpty()) {
                log.debug("Skipping malformed batch item");
                continue;
            }
            PixelEventRequest event = read.get();

            ValidationResult validation = validator.validate(event);
            if (validation.hasErrors()) {
                log.debug("Skipping invalid batch item: eventId={}, errors={}", event.getEventId(), validation.errors());
                continue;
            }
            if (!deduplicator.shouldStore(event)) {
                continue;
            }

            identityUpserter.touchIdentity(event);
            identityUpserter.touchSession(event);
            eventWriter.insertEvent(normalizer.normalize(event, context));
            ingested++;
        }

        if (ingested > 0) {
            eventWriter.writeBatchMetadata(context);
        }
        return ingested;
    }
}
