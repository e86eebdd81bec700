package com.pixeltrack.ingest.repository;

import com.pixeltrack.ingest.entity.PixelEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Insert-only store for pixel events. Rows are never updated or deleted by the service.
 */
@Repository
public interface PixelEventRepository extends JpaRepository<PixelEvent, Long> {

    long countByEventNameAndEventId(String eventName, String eventId);
}
