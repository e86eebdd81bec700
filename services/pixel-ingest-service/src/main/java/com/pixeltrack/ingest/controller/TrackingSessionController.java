package com.pixeltrack.ingest.controller;

import com.pixeltrack.ingest.dto.SessionUpsertRequest;
import com.pixeltrack.ingest.entity.TrackingSession;
import com.pixeltrack.ingest.service.TrackingSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/sessions")
@RequiredArgsConstructor
@Tag(name = "Sessions", description = "Explicit session upserts and listing")
public class TrackingSessionController {

    private final TrackingSessionService trackingSessionService;

    @PostMapping
    @Operation(summary = "Upsert a session", description = "First page is kept once set; last page follows the latest value")
    public ResponseEntity<TrackingSession> upsert(@Valid @RequestBody SessionUpsertRequest request) {
        return ResponseEntity.ok(trackingSessionService.upsert(request));
    }

    @GetMapping
    @Operation(summary = "List sessions")
    public ResponseEntity<List<TrackingSession>> getAll() {
        return ResponseEntity.ok(trackingSessionService.getAllSessions());
    }
}
