package com.pixeltrack.ingest.controller;

import com.pixeltrack.ingest.config.IngestionProperties;
import com.pixeltrack.ingest.model.RequestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RequestContextResolver Unit Tests")
class RequestContextResolverTest {

    private final RequestContextResolver resolver = new RequestContextResolver(new IngestionProperties());

    @Test
    @DisplayName("Should take the first forwarded-for hop as the client IP")
    void shouldUseFirstForwardedHop() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/events");
        request.setRemoteAddr("10.0.0.5");
        request.addHeader("X-Forwarded-For", " 203.0.113.7 , 10.0.0.1");

        assertThat(resolver.resolve(request).getIpAddress()).isEqualTo("203.0.113.7");
    }

    @Test
    @DisplayName("Should fall back to the peer address")
    void shouldFallBackToRemoteAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/events");
        request.setRemoteAddr("10.0.0.5");

        assertThat(resolver.resolve(request).getIpAddress()).isEqualTo("10.0.0.5");
    }

    @Test
    @DisplayName("Should capture lower-cased headers, user agent and request id")
    void shouldCaptureHeaders() {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/events");
        request.addHeader("User-Agent", "Mozilla/5.0");
        request.addHeader("X-Request-Id", "req-42");
        request.addHeader("Accept-Language", "pt-BR");
        request.addHeader("Accept-Language", "en");

        // When
        RequestContext context = resolver.resolve(request);

        // Then
        assertThat(context.getUserAgent()).isEqualTo("Mozilla/5.0");
        assertThat(context.getRequestId()).isEqualTo("req-42");
        assertThat(context.getHeaders())
            .containsEntry("user-agent", "Mozilla/5.0")
            .containsEntry("x-request-id", "req-42")
            .containsEntry("accept-language", "pt-BR, en");
    }

    @Test
    @DisplayName("Should honour configured header names")
    void shouldUseConfiguredHeaderNames() {
        IngestionProperties properties = new IngestionProperties();
        properties.getRequest().setForwardedForHeader("CF-Connecting-IP");
        properties.getRequest().setRequestIdHeader("X-Trace-Id");
        RequestContextResolver custom = new RequestContextResolver(properties);

        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/events");
        request.addHeader("CF-Connecting-IP", "198.51.100.3");
        request.addHeader("X-Trace-Id", "trace-1");

        RequestContext context = custom.resolve(request);

        assertThat(context.getIpAddress()).isEqualTo("198.51.100.3");
        assertThat(context.getRequestId()).isEqualTo("trace-1");
    }
}
