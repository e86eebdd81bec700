package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.dto.PixelEventRequest;
import com.pixeltrack.ingest.entity.PixelEvent;
import com.pixeltrack.ingest.model.RequestContext;
import com.pixeltrack.ingest.util.PayloadValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a validated {@link PixelEventRequest} into an unsaved {@link PixelEvent}.
 *
 * <p>Occurrence time is resolved in this order:
 * <ol>
 *   <li>{@code occurred_at}, when it parses as ISO-8601 or epoch milliseconds</li>
 *   <li>the legacy {@code timestamp} field, when non-zero</li>
 *   <li>the current time</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventNormalizer {

    private final LegacyCampaignMapper campaignMapper;
    private final Clock clock;

    public PixelEvent normalize(PixelEventRequest event, RequestContext context) {
        Instant occurredAt = resolveOccurredAt(event);
        Long epochMillis = event.getTimestamp() != null ? event.getTimestamp() : occurredAt.toEpochMilli();
        Map<String, Object> viewport = event.getViewport();

        return PixelEvent.builder()
                .eventId(event.getEventId())
                .eventName(event.getEventName())
                .epochMillis(epochMillis)
                .clientId(event.getClientId())
                .sessionId(PayloadValues.blankToNull(event.getSessionId()))
                .occurredAt(occurredAt)
                .pageLocation(PayloadValues.blankToNull(event.getPageLocation()))
                .pageReferrer(PayloadValues.blankToNull(event.getPageReferrer()))
                .pageTitle(PayloadValues.blankToNull(event.getPageTitle()))
                .userAgent(resolveUserAgent(event, context))
                .language(PayloadValues.blankToNull(event.getLanguage()))
                .viewportWidth(viewport == null ? null : PayloadValues.nonZeroInt(viewport.get("width")))
                .viewportHeight(viewport == null ? null : PayloadValues.nonZeroInt(viewport.get("height")))
                .timezoneOffset(PayloadValues.finiteDouble(event.getTimezoneOffset()))
                .utmSource(PayloadValues.blankToNull(event.getUtmSource()))
                .utmMedium(PayloadValues.blankToNull(event.getUtmMedium()))
                .utmCampaign(PayloadValues.blankToNull(event.getUtmCampaign()))
                .utmContent(PayloadValues.blankToNull(event.getUtmContent()))
                .utmTerm(PayloadValues.blankToNull(event.getUtmTerm()))
                .message(PayloadValues.blankToNull(event.getMessage()))
                .screen(event.getScreen())
                .viewport(viewport)
                .network(event.getNetwork())
                .performance(event.getPerformance())
                .campaign(campaignMapper.resolveCampaign(event))
                .attribution(event.getAttribution())
                .referrerChain(referrerChain(event.getReferrerChain()))
                .navigation(event.getNavigation())
                .click(event.getClick())
                .form(event.getForm())
                .engagement(event.getEngagement())
                .ecommerce(event.getEcommerce())
                .browserHints(event.getBrowserHints())
                .experiment(event.getExperiment())
                .fbp(PayloadValues.blankToNull(event.getFbp()))
                .fbc(PayloadValues.blankToNull(event.getFbc()))
                .validationWarnings(event.getValidationWarnings())
                .validationErrors(event.getValidationErrors())
                .botScore(Optional.ofNullable(PayloadValues.finiteDouble(event.getBotScore())).orElse(0d))
                .rawPayload(event.getRawPayload())
                .build();
    }

    private Instant resolveOccurredAt(PixelEventRequest event) {
        if (event.getOccurredAt() != null) {
            Optional<Instant> explicit = PayloadValues.parseInstant(event.getOccurredAt());
            if (explicit.isPresent()) {
                return explicit.get();
            }
            log.debug("Ignoring unparseable occurred_at '{}' on event {}", event.getOccurredAt(), event.getEventId());
        }
        Long timestamp = event.getTimestamp();
        if (timestamp != null && timestamp != 0L) {
            return Instant.ofEpochMilli(timestamp);
        }
        return clock.instant();
    }

    private String resolveUserAgent(PixelEventRequest event, RequestContext context) {
        String userAgent = PayloadValues.blankToNull(event.getUserAgent());
        return userAgent != null ? userAgent : context.getUserAgent();
    }

    private List<Object> referrerChain(Object value) {
        return value instanceof List<?> list ? new ArrayList<>(list) : null;
    }
}
