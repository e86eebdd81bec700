package com.pixeltrack.ingest.repository;

import com.pixeltrack.ingest.entity.TrackingSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TrackingSessionRepository extends JpaRepository<TrackingSession, String>,
        TrackingSessionUpsertRepository {

    List<TrackingSession> findByClientId(String clientId);
}
