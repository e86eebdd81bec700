package com.pixeltrack.ingest.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.pixeltrack.ingest.dto.BatchIngestionResponse;
import com.pixeltrack.ingest.dto.EventIngestionResponse;
import com.pixeltrack.ingest.dto.InvalidEventResponse;
import com.pixeltrack.ingest.dto.LegacyPurchaseRequest;
import com.pixeltrack.ingest.exception.ErrorResponse;
import com.pixeltrack.ingest.model.BatchIngestionResult;
import com.pixeltrack.ingest.model.IngestionResult;
import com.pixeltrack.ingest.service.BulkIngestionCoordinator;
import com.pixeltrack.ingest.service.EventIngestionService;
import com.pixeltrack.ingest.service.LegacyPurchaseService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pixel event intake: single events, bulk submissions and legacy purchases.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Pixel Events", description = "Tracking pixel event ingestion")
public class PixelEventController {

    private final EventIngestionService eventIngestionService;
    private final BulkIngestionCoordinator bulkIngestionCoordinator;
    private final LegacyPurchaseService legacyPurchaseService;
    private final RequestContextResolver requestContextResolver;

    @PostMapping("/events")
    @Operation(summary = "Ingest one event", description = "Validates, deduplicates and stores a single pixel event")
    @ApiResponse(responseCode = "200", description = "Event stored or recognised as a duplicate")
    @ApiResponse(responseCode = "400", description = "Event failed validation")
    @ApiResponse(responseCode = "500", description = "Event could not be stored")
    public ResponseEntity<Object> ingestEvent(@RequestBody(required = false) JsonNode body,
                                              HttpServletRequest request) {
        IngestionResult result = eventIngestionService.ingest(body, requestContextResolver.resolve(request));
        return toResponse(result);
    }

    @PostMapping("/events/bulk")
    @Operation(summary = "Ingest a batch of events",
            description = "Stores every valid, non-duplicate event of a JSON array in one transaction")
    @ApiResponse(responseCode = "200", description = "Batch committed; the count excludes skipped items")
    @ApiResponse(responseCode = "500", description = "Batch rolled back")
    public ResponseEntity<Object> ingestBatch(@RequestBody(required = false) JsonNode body,
                                              HttpServletRequest request) {
        List<JsonNode> items = new ArrayList<>();
        if (body != null && body.isArray()) {
            body.forEach(items::add);
        }

        BatchIngestionResult result = bulkIngestionCoordinator.ingestBatch(items, requestContextResolver.resolve(request));
        if (result.storageFailed()) {
            return storageFailure("Unable to store event batch");
        }
        return ResponseEntity.ok(new BatchIngestionResponse(true, result.ingested()));
    }

    @PostMapping("/purchases")
    @Operation(summary = "Record a legacy purchase", description = "Converts the purchase into a purchase event")
    public ResponseEntity<Object> recordPurchase(@RequestBody(required = false) LegacyPurchaseRequest body,
                                                 HttpServletRequest request) {
        LegacyPurchaseRequest purchase = body == null ? new LegacyPurchaseRequest() : body;
        IngestionResult result = legacyPurchaseService.recordPurchase(purchase, requestContextResolver.resolve(request));
        return toResponse(result);
    }

    private ResponseEntity<Object> toResponse(IngestionResult result) {
        switch (result.getStatus()) {
            case STORED:
                return ResponseEntity.ok(EventIngestionResponse.stored(result.getEventDbId(), result.getWarnings()));
            case DEDUPLICATED:
                return ResponseEntity.ok(EventIngestionResponse.deduplicated());
            case REJECTED:
                return ResponseEntity.badRequest()
                        .body(InvalidEventResponse.of(result.getErrors(), result.getWarnings()));
            case STORAGE_FAILED:
                return storageFailure("Unable to store event");
            default:
                throw new IllegalStateException("Unhandled ingestion status: " + result.getStatus());
        }
    }

    private ResponseEntity<Object> storageFailure(String message) {
        ErrorResponse errorResponse = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error(ErrorResponse.DB_ERROR)
                .message(message)
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }
}
