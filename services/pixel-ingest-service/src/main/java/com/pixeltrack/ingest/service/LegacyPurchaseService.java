package com.pixeltrack.ingest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pixeltrack.ingest.dto.LegacyPurchaseRequest;
import com.pixeltrack.ingest.model.IngestionResult;
import com.pixeltrack.ingest.model.RequestContext;
import com.pixeltrack.ingest.util.PayloadValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a legacy purchase into a {@code purchase} event and runs it through
 * the single-event pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LegacyPurchaseService {

    static final String LEGACY_MESSAGE = "legacy /purchases";

    private final EventIngestionService eventIngestionService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public IngestionResult recordPurchase(LegacyPurchaseRequest request, RequestContext context) {
        log.debug("Converting legacy purchase: purchaseId={}, clientId={}", request.getPurchaseId(), request.getClientId());
        return eventIngestionService.ingest(toEvent(request), context);
    }

    JsonNode toEvent(LegacyPurchaseRequest request) {
        Map<String, Object> ecommerce = new LinkedHashMap<>();
        ecommerce.put("value", request.getValue() == null ? BigDecimal.ZERO : request.getValue());
        ecommerce.put("currency", PayloadValues.blankToNull(request.getCurrency()));
        ecommerce.put("items", request.getItems() == null ? List.of() : request.getItems());

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event_id", request.getPurchaseId());
        event.put("event_name", PixelEventValidator.PURCHASE_EVENT);
        event.put("client_id", request.getClientId());
        event.put("session_id", request.getSessionId());
        Long timestamp = request.getTimestamp();
        event.put("timestamp", timestamp == null || timestamp == 0L ? clock.millis() : timestamp);
        event.put("ecommerce", ecommerce);
        event.put("message", LEGACY_MESSAGE);
        return objectMapper.valueToTree(event);
    }
}
