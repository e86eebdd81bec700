package com.pixeltrack.ingest.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pixeltrack.ingest.dto.PixelEventRequest;

/**
 * Payload builders shared by tests.
 */
public final class TestEvents {

    private TestEvents() {
    }

    public static PixelEventRequest pageView(String eventId) {
        return PixelEventRequest.builder()
                .eventId(eventId)
                .eventName("page_view")
                .clientId("client-1")
                .sessionId("session-1")
                .pageLocation("https://shop.example.com/a")
                .build();
    }

    public static ObjectNode pageViewNode(ObjectMapper objectMapper, String eventId) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("event_id", eventId);
        node.put("event_name", "page_view");
        node.put("client_id", "client-1");
        node.put("session_id", "session-1");
        node.put("page_location", "https://shop.example.com/a");
        return node;
    }
}
