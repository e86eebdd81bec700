package com.pixeltrack.ingest.controller;

import com.pixeltrack.ingest.config.IngestionProperties;
import com.pixeltrack.ingest.model.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Captures the transport facts of an inbound request for metadata rows.
 */
@Component
@RequiredArgsConstructor
public class RequestContextResolver {

    private final IngestionProperties properties;

    public RequestContext resolve(HttpServletRequest request) {
        return RequestContext.builder()
                .ipAddress(resolveIpAddress(request))
                .headers(collectHeaders(request))
                .userAgent(request.getHeader(HttpHeaders.USER_AGENT))
                .requestId(request.getHeader(properties.getRequest().getRequestIdHeader()))
                .build();
    }

    /**
     * First entry of the forwarded-for chain, else the peer address.
     */
    String resolveIpAddress(HttpServletRequest request) {
        String forwardedFor = request.getHeader(properties.getRequest().getForwardedForHeader());
        if (StringUtils.hasText(forwardedFor)) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return request.getRemoteAddr();
    }

    private Map<String, String> collectHeaders(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            String values = String.join(", ", Collections.list(request.getHeaders(name)));
            headers.merge(name.toLowerCase(Locale.ROOT), values, (existing, added) -> existing + ", " + added);
        }
        return headers;
    }
}
