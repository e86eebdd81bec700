package com.pixeltrack.ingest.repository;

import com.pixeltrack.ingest.entity.RequestMetadata;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RequestMetadataRepository extends JpaRepository<RequestMetadata, Long> {

    List<RequestMetadata> findByPixelEventId(Long pixelEventId);
}
