package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.entity.PixelEvent;
import com.pixeltrack.ingest.entity.RequestMetadata;
import com.pixeltrack.ingest.model.RequestContext;
import com.pixeltrack.ingest.repository.PixelEventRepository;
import com.pixeltrack.ingest.repository.RequestMetadataRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventWriter Unit Tests")
class EventWriterTest {

    @Mock
    private PixelEventRepository pixelEventRepository;

    @Mock
    private RequestMetadataRepository requestMetadataRepository;

    @InjectMocks
    private EventWriter eventWriter;

    @Captor
    private ArgumentCaptor<RequestMetadata> metadataCaptor;

    private final RequestContext context = RequestContext.builder()
        .ipAddress("203.0.113.7")
        .headers(Map.of("user-agent", "Mozilla/5.0"))
        .userAgent("Mozilla/5.0")
        .requestId("req-1")
        .build();

    @Test
    @DisplayName("Should write the event and a metadata row referencing its id")
    void shouldWriteEventWithMetadata() {
        // Given
        PixelEvent event = PixelEvent.builder().eventId("e-1").eventName("page_view")
            .clientId("c-1").occurredAt(Instant.now()).build();
        when(pixelEventRepository.saveAndFlush(event)).thenAnswer(invocation -> {
            event.setId(42L);
            return event;
        });

        // When
        Long id = eventWriter.writeEvent(event, context);

        // Then
        assertThat(id).isEqualTo(42L);
        verify(requestMetadataRepository).save(metadataCaptor.capture());
        RequestMetadata metadata = metadataCaptor.getValue();
        assertThat(metadata.getPixelEventId()).isEqualTo(42L);
        assertThat(metadata.getIpAddress()).isEqualTo("203.0.113.7");
        assertThat(metadata.getRequestId()).isEqualTo("req-1");
        assertThat(metadata.getHeaders()).containsEntry("user-agent", "Mozilla/5.0");
        assertThat(metadata.getGeoLocation()).isNull();
        assertThat(metadata.isBatchLevel()).isFalse();
    }

    @Test
    @DisplayName("Should reference the batch sentinel for bulk metadata")
    void shouldWriteBatchMetadata() {
        when(requestMetadataRepository.save(any(RequestMetadata.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RequestMetadata metadata = eventWriter.writeBatchMetadata(context);

        assertThat(metadata.getPixelEventId()).isEqualTo(RequestMetadata.BATCH_EVENT_REFERENCE);
        assertThat(metadata.isBatchLevel()).isTrue();
        verifyNoInteractions(pixelEventRepository);
    }
}
