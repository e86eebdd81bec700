package com.pixeltrack.ingest.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Read-only facts about the HTTP request that carried one event or one batch.
 */
@Value
@Builder
public class RequestContext {

    /**
     * First hop of the forwarded-for chain, else the transport peer address.
     */
    String ipAddress;

    /**
     * Lower-cased header names; repeated headers joined with ", ".
     */
    Map<String, String> headers;

    String userAgent;

    String requestId;

    public static RequestContext empty() {
        return RequestContext.builder().headers(Map.of()).build();
    }
}
