package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.dto.PixelEventRequest;
import com.pixeltrack.ingest.entity.ClientIdentity;
import com.pixeltrack.ingest.entity.TrackingSession;
import com.pixeltrack.ingest.repository.ClientIdentityRepository;
import com.pixeltrack.ingest.repository.TrackingSessionRepository;
import com.pixeltrack.ingest.support.TestEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IdentityUpserter Unit Tests")
class IdentityUpserterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ClientIdentityRepository clientIdentityRepository;

    @Mock
    private TrackingSessionRepository trackingSessionRepository;

    @Captor
    private ArgumentCaptor<ClientIdentity> identityCaptor;

    @Captor
    private ArgumentCaptor<TrackingSession> sessionCaptor;

    private IdentityUpserter upserter;

    @BeforeEach
    void setUp() {
        upserter = new IdentityUpserter(clientIdentityRepository, trackingSessionRepository,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should merge identify fields and traits into the client row")
    void shouldMergeIdentity() {
        // Given
        PixelEventRequest event = TestEvents.pageView("e-1");
        event.setIdentify(PixelEventRequest.Identify.builder().userId("u-1").emailSha256("ab12").build());
        event.setTraits(Map.of("plan", "pro"));

        // When
        upserter.upsertIdentity(event);

        // Then
        verify(clientIdentityRepository).mergeFromEvent(identityCaptor.capture());
        ClientIdentity incoming = identityCaptor.getValue();
        assertThat(incoming.getClientId()).isEqualTo("client-1");
        assertThat(incoming.getUserId()).isEqualTo("u-1");
        assertThat(incoming.getEmailSha256()).isEqualTo("ab12");
        assertThat(incoming.getPhoneSha256()).isNull();
        assertThat(incoming.getTraits()).containsEntry("plan", "pro");
        assertThat(incoming.getLastSeen()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should pass null traits when the event carries none")
    void shouldLeaveTraitsUntouched() {
        upserter.upsertIdentity(TestEvents.pageView("e-1"));

        verify(clientIdentityRepository).mergeFromEvent(identityCaptor.capture());
        assertThat(identityCaptor.getValue().getTraits()).isNull();
        assertThat(identityCaptor.getValue().getUserId()).isNull();
    }

    @Test
    @DisplayName("Should use started_at from the event and the page for both ends")
    void shouldMergeSession() {
        // Given
        PixelEventRequest event = TestEvents.pageView("e-1");
        event.setStartedAt("2024-05-01T09:55:00Z");

        // When
        upserter.upsertSession(event);

        // Then
        verify(trackingSessionRepository).merge(sessionCaptor.capture());
        TrackingSession incoming = sessionCaptor.getValue();
        assertThat(incoming.getSessionId()).isEqualTo("session-1");
        assertThat(incoming.getClientId()).isEqualTo("client-1");
        assertThat(incoming.getStartedAt()).isEqualTo(Instant.parse("2024-05-01T09:55:00Z"));
        assertThat(incoming.getFirstPage()).isEqualTo("https://shop.example.com/a");
        assertThat(incoming.getLastPage()).isEqualTo("https://shop.example.com/a");
    }

    @Test
    @DisplayName("Should default session start to now")
    void shouldDefaultSessionStart() {
        upserter.upsertSession(TestEvents.pageView("e-1"));

        verify(trackingSessionRepository).merge(sessionCaptor.capture());
        assertThat(sessionCaptor.getValue().getStartedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should do nothing without identifiers")
    void shouldSkipWithoutIdentifiers() {
        PixelEventRequest anonymous = TestEvents.pageView("e-1");
        anonymous.setClientId(null);
        anonymous.setSessionId("");

        upserter.upsertIdentity(anonymous);
        upserter.upsertSession(anonymous);
        upserter.touchIdentity(anonymous);
        upserter.touchSession(anonymous);

        verifyNoInteractions(clientIdentityRepository, trackingSessionRepository);
    }

    @Test
    @DisplayName("Should issue minimal upserts for bulk ingestion")
    void shouldTouch() {
        PixelEventRequest event = TestEvents.pageView("e-1");

        upserter.touchIdentity(event);
        upserter.touchSession(event);

        verify(clientIdentityRepository).touchLastSeen("client-1", NOW);
        verify(trackingSessionRepository).touchOwner("session-1", "client-1", NOW);
        verifyNoMoreInteractions(clientIdentityRepository, trackingSessionRepository);
    }
}
