package com.pixeltrack.ingest.repository;

import com.pixeltrack.ingest.entity.ClientIdentity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Client identities. Lookups come from Spring Data, writes from the
 * {@link ClientIdentityUpsertRepository} upsert statements.
 */
@Repository
public interface ClientIdentityRepository extends JpaRepository<ClientIdentity, String>,
        ClientIdentityUpsertRepository {
}
