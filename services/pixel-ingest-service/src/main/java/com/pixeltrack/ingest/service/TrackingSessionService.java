package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.dto.SessionUpsertRequest;
import com.pixeltrack.ingest.entity.TrackingSession;
import com.pixeltrack.ingest.exception.ResourceNotFoundException;
import com.pixeltrack.ingest.repository.TrackingSessionRepository;
import com.pixeltrack.ingest.util.PayloadValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Explicit session writes and listing behind {@code /sessions}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackingSessionService {

    private final TrackingSessionRepository trackingSessionRepository;
    private final Clock clock;

    @Transactional
    public TrackingSession upsert(SessionUpsertRequest request) {
        TrackingSession incoming = TrackingSession.builder()
                .sessionId(request.getSessionId())
                .clientId(PayloadValues.blankToNull(request.getClientId()))
                .startedAt(PayloadValues.parseInstant(request.getStartedAt()).orElseGet(clock::instant))
                .firstPage(PayloadValues.blankToNull(request.getFirstPage()))
                .lastPage(PayloadValues.blankToNull(request.getLastPage()))
                .build();

        trackingSessionRepository.merge(incoming);
        log.info("Upserted session: sessionId={}, clientId={}", request.getSessionId(), request.getClientId());

        return trackingSessionRepository.findById(request.getSessionId())
                .orElseThrow(() -> new ResourceNotFoundException("Session", request.getSessionId()));
    }

    @Transactional(readOnly = true)
    public List<TrackingSession> getAllSessions() {
        return trackingSessionRepository.findAll();
    }
}
