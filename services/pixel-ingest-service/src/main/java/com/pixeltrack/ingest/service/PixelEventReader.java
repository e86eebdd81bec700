package com.pixeltrack.ingest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pixeltrack.ingest.dto.PixelEventRequest;
import com.pixeltrack.ingest.util.LenientPayloadModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Binds a raw JSON object to {@link PixelEventRequest} and keeps the untouched
 * object as its raw payload.
 *
 * <p>Binding goes through {@link LenientPayloadModule}: an optional field with
 * an unexpected shape is read as absent and the event is still accepted.
 */
@Slf4j
@Component
public class PixelEventReader {

    private static final TypeReference<Map<String, Object>> RAW_MAP = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public PixelEventReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().registerModule(new LenientPayloadModule());
    }

    /**
     * @return the bound event, or empty when the node is not a JSON object
     */
    public Optional<PixelEventRequest> read(JsonNode node) {
        JsonNode source = node == null || node.isNull() ? objectMapper.createObjectNode() : node;
        if (!source.isObject()) {
            log.debug("Rejecting pixel payload of type {}", source.getNodeType());
            return Optional.empty();
        }
        try {
            PixelEventRequest event = objectMapper.treeToValue(source, PixelEventRequest.class);
            event.setRawPayload(objectMapper.convertValue(source, RAW_MAP));
            return Optional.of(event);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Unable to bind pixel payload: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
