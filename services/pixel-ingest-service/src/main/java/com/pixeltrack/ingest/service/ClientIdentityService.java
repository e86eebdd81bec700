package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.dto.ClientIdentityUpsertRequest;
import com.pixeltrack.ingest.entity.ClientIdentity;
import com.pixeltrack.ingest.exception.ResourceNotFoundException;
import com.pixeltrack.ingest.repository.ClientIdentityRepository;
import com.pixeltrack.ingest.util.PayloadValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Explicit client identity writes and lookups behind {@code /users}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientIdentityService {

    private final ClientIdentityRepository clientIdentityRepository;
    private final Clock clock;

    /**
     * Overwrites traits ({@code {}} when absent) and last-seen, coalesces the
     * resolved identity fields, and returns the stored row.
     */
    @Transactional
    public ClientIdentity upsert(ClientIdentityUpsertRequest request) {
        ClientIdentity incoming = ClientIdentity.builder()
                .clientId(request.getClientId())
                .traits(request.getTraits() == null ? Map.of() : request.getTraits())
                .lastSeen(PayloadValues.parseInstant(request.getLastSeen()).orElseGet(clock::instant))
                .userId(PayloadValues.blankToNull(request.getUserId()))
                .emailSha256(PayloadValues.blankToNull(request.getEmailSha256()))
                .phoneSha256(PayloadValues.blankToNull(request.getPhoneSha256()))
                .build();

        clientIdentityRepository.replaceTraitsAndMerge(incoming);
        log.info("Upserted client identity: clientId={}", request.getClientId());

        return getIdentity(request.getClientId());
    }

    @Transactional(readOnly = true)
    public ClientIdentity getIdentity(String clientId) {
        return clientIdentityRepository.findById(clientId)
                .orElseThrow(() -> new ResourceNotFoundException("Client identity", clientId));
    }

    @Transactional(readOnly = true)
    public List<ClientIdentity> getAllIdentities() {
        return clientIdentityRepository.findAll();
    }
}
