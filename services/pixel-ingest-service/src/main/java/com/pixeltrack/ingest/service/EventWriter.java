package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.entity.PixelEvent;
import com.pixeltrack.ingest.entity.RequestMetadata;
import com.pixeltrack.ingest.model.RequestContext;
import com.pixeltrack.ingest.repository.PixelEventRepository;
import com.pixeltrack.ingest.repository.RequestMetadataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes event rows and their request metadata.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventWriter {

    private final PixelEventRepository pixelEventRepository;
    private final RequestMetadataRepository requestMetadataRepository;

    /**
     * Inserts the event and one metadata row referencing it, atomically.
     *
     * @return the database id of the new event row
     */
    @Transactional
    public Long writeEvent(PixelEvent event, RequestContext context) {
        PixelEvent saved = insertEvent(event);
        requestMetadataRepository.save(metadataFor(saved.getId(), context));
        log.debug("Stored event: id={}, name={}, eventId={}", saved.getId(), saved.getEventName(), saved.getEventId());
        return saved.getId();
    }

    /**
     * Inserts the event row only. Must join the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PixelEvent insertEvent(PixelEvent event) {
        return pixelEventRepository.saveAndFlush(event);
    }

    /**
     * Writes the single aggregate metadata row of a bulk request.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public RequestMetadata writeBatchMetadata(RequestContext context) {
        return requestMetadataRepository.save(metadataFor(RequestMetadata.BATCH_EVENT_REFERENCE, context));
    }

    private RequestMetadata metadataFor(Long pixelEventId, RequestContext context) {
        return RequestMetadata.builder()
                .pixelEventId(pixelEventId)
                .ipAddress(context.getIpAddress())
                .headers(context.getHeaders())
                .userAgent(context.getUserAgent())
                .requestId(context.getRequestId())
                .build();
    }
}
