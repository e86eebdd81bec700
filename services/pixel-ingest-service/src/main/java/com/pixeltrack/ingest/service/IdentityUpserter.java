package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.dto.PixelEventRequest;
import com.pixeltrack.ingest.entity.ClientIdentity;
import com.pixeltrack.ingest.entity.TrackingSession;
import com.pixeltrack.ingest.repository.ClientIdentityRepository;
import com.pixeltrack.ingest.repository.TrackingSessionRepository;
import com.pixeltrack.ingest.util.PayloadValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;

/**
 * Keeps {@code pixel_users} and {@code pixel_sessions} in step with incoming
 * events. Each call is a single upsert statement and is a no-op when the event
 * lacks the relevant identifier.
 *
 * <p>The full variants are used for single events; the {@code touch} variants
 * are the minimal upserts used by bulk ingestion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityUpserter {

    private final ClientIdentityRepository clientIdentityRepository;
    private final TrackingSessionRepository trackingSessionRepository;
    private final Clock clock;

    @Transactional
    public void upsertIdentity(PixelEventRequest event) {
        if (!StringUtils.hasText(event.getClientId())) {
            return;
        }
        PixelEventRequest.Identify identify = event.getIdentify();
        ClientIdentity incoming = ClientIdentity.builder()
                .clientId(event.getClientId())
                .traits(event.getTraits())
                .lastSeen(clock.instant())
                .userId(identify == null ? null : identify.getUserId())
                .emailSha256(identify == null ? null : identify.getEmailSha256())
                .phoneSha256(identify == null ? null : identify.getPhoneSha256())
                .build();
        clientIdentityRepository.mergeFromEvent(incoming);
    }

    @Transactional
    public void upsertSession(PixelEventRequest event) {
        if (!StringUtils.hasText(event.getSessionId())) {
            return;
        }
        String page = PayloadValues.blankToNull(event.getPageLocation());
        TrackingSession incoming = TrackingSession.builder()
                .sessionId(event.getSessionId())
                .clientId(event.getClientId())
                .startedAt(PayloadValues.parseInstant(event.getStartedAt()).orElseGet(clock::instant))
                .firstPage(page)
                .lastPage(page)
                .build();
        trackingSessionRepository.merge(incoming);
    }

    @Transactional
    public void touchIdentity(PixelEventRequest event) {
        if (StringUtils.hasText(event.getClientId())) {
            clientIdentityRepository.touchLastSeen(event.getClientId(), clock.instant());
        }
    }

    @Transactional
    public void touchSession(PixelEventRequest event) {
        if (StringUtils.hasText(event.getSessionId())) {
            trackingSessionRepository.touchOwner(event.getSessionId(), event.getClientId(), clock.instant());
        }
    }
}
