package com.pixeltrack.ingest.controller;

import com.pixeltrack.ingest.dto.ClientIdentityUpsertRequest;
import com.pixeltrack.ingest.entity.ClientIdentity;
import com.pixeltrack.ingest.service.ClientIdentityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
@Tag(name = "Client Identities", description = "Explicit visitor identity upserts and lookups")
public class ClientIdentityController {

    private final ClientIdentityService clientIdentityService;

    @PostMapping
    @Operation(summary = "Upsert a client identity",
            description = "Replaces traits, refreshes last-seen and merges resolved identity fields")
    public ResponseEntity<ClientIdentity> upsert(@Valid @RequestBody ClientIdentityUpsertRequest request) {
        return ResponseEntity.ok(clientIdentityService.upsert(request));
    }

    @GetMapping
    @Operation(summary = "List client identities")
    public ResponseEntity<List<ClientIdentity>> getAll() {
        return ResponseEntity.ok(clientIdentityService.getAllIdentities());
    }

    @GetMapping("/{clientId}")
    @Operation(summary = "Get one client identity")
    public ResponseEntity<ClientIdentity> get(@Parameter(description = "Pixel client id") @PathVariable String clientId) {
        return ResponseEntity.ok(clientIdentityService.getIdentity(clientId));
    }
}
