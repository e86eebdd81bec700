package com.pixeltrack.ingest.metrics;

import com.pixeltrack.ingest.model.IngestionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for pixel ingestion outcomes
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionMetricsService {

    private final MeterRegistry meterRegistry;

    private Counter eventsReceivedCounter;
    private Counter batchesReceivedCounter;
    private Counter batchEventsIngestedCounter;
    private Counter batchStorageFailureCounter;

    @PostConstruct
    public void initMetrics() {
        eventsReceivedCounter = Counter.builder("pixel.events.received")
                .description("Total number of single events received")
                .register(meterRegistry);

        batchesReceivedCounter = Counter.builder("pixel.batches.received")
                .description("Total number of bulk submissions received")
                .register(meterRegistry);

        batchEventsIngestedCounter = Counter.builder("pixel.batches.events.ingested")
                .description("Total number of events committed through bulk submissions")
                .register(meterRegistry);

        batchStorageFailureCounter = Counter.builder("pixel.batches.storage_failed")
                .description("Total number of bulk submissions rolled back")
                .register(meterRegistry);
    }

    public void recordEventReceived() {
        eventsReceivedCounter.increment();
    }

    /**
     * Record the outcome of one single-event submission
     */
    public void recordEventOutcome(IngestionResult.Status status) {
        Counter.builder("pixel.events.outcome")
                .description("Single event outcomes by status")
                .tag("status", status.name().toLowerCase())
                .register(meterRegistry)
                .increment();

        log.debug("Recorded event outcome: status={}", status);
    }

    public void recordBatch(int size, int ingested, boolean storageFailed) {
        batchesReceivedCounter.increment();
        if (storageFailed) {
            batchStorageFailureCounter.increment();
        } else {
            batchEventsIngestedCounter.increment(ingested);
        }
        log.debug("Recorded batch: size={}, ingested={}, storageFailed={}", size, ingested, storageFailed);
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopTimer(Timer.Sample sample, String operation) {
        sample.stop(Timer.builder("pixel.ingest.duration")
                .description("Time taken to ingest a request")
                .tag("operation", operation)
                .register(meterRegistry));
    }
}
