package com.pixeltrack.ingest.repository;

import com.pixeltrack.ingest.entity.ClientIdentity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration Tests for the client identity upserts
 *
 * Runs the ON CONFLICT statements against a real PostgreSQL.
 */
@DataJpaTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@DisplayName("ClientIdentityRepository Integration Tests")
class ClientIdentityRepositoryTest {

    private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-01T11:00:00Z");

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
        .withDatabaseName("pixel_test")
        .withUsername("test")
        .withPassword("test");

    @DynamicPropertySource
    static void configure(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private ClientIdentityRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("Should keep an existing user id when the event lacks one and replace it with a new value")
    void shouldCoalesceUserId() {
        // Given
        repository.mergeFromEvent(identity("c-1", T1).userId("u-1").build());

        // When
        repository.mergeFromEvent(identity("c-1", T2).build());

        // Then
        ClientIdentity afterAnonymous = reload("c-1");
        assertThat(afterAnonymous.getUserId()).isEqualTo("u-1");
        assertThat(afterAnonymous.getLastSeen()).isEqualTo(T2);

        // When
        repository.mergeFromEvent(identity("c-1", T2).userId("u-2").build());

        // Then
        assertThat(reload("c-1").getUserId()).isEqualTo("u-2");
    }

    @Test
    @DisplayName("Should create rows with empty traits and keep traits unless the event carries some")
    void shouldKeepTraitsUnlessProvided() {
        repository.mergeFromEvent(identity("c-1", T1).build());
        assertThat(reload("c-1").getTraits()).isEmpty();

        repository.mergeFromEvent(identity("c-1", T1).traits(Map.of("plan", "pro")).build());
        repository.mergeFromEvent(identity("c-1", T2).build());

        assertThat(reload("c-1").getTraits()).containsEntry("plan", "pro");
    }

    @Test
    @DisplayName("Should overwrite traits wholesale on explicit upsert but coalesce identity fields")
    void shouldReplaceTraits() {
        // Given
        repository.mergeFromEvent(identity("c-1", T1)
            .traits(Map.of("plan", "pro", "country", "BR"))
            .emailSha256("e3b0c442")
            .build());

        // When
        repository.replaceTraitsAndMerge(identity("c-1", T2).traits(Map.of("plan", "free")).build());

        // Then
        ClientIdentity stored = reload("c-1");
        assertThat(stored.getTraits()).containsExactly(Map.entry("plan", "free"));
        assertThat(stored.getEmailSha256()).isEqualTo("e3b0c442");
    }

    @Test
    @DisplayName("Should only refresh last seen on touch")
    void shouldTouchLastSeen() {
        repository.mergeFromEvent(identity("c-1", T1).userId("u-1").traits(Map.of("plan", "pro")).build());

        repository.touchLastSeen("c-1", T2);
        repository.touchLastSeen("c-2", T2);

        ClientIdentity touched = reload("c-1");
        assertThat(touched.getLastSeen()).isEqualTo(T2);
        assertThat(touched.getUserId()).isEqualTo("u-1");
        assertThat(touched.getTraits()).containsEntry("plan", "pro");
        assertThat(reload("c-2").getTraits()).isEmpty();
    }

    private ClientIdentity.ClientIdentityBuilder identity(String clientId, Instant lastSeen) {
        return ClientIdentity.builder().clientId(clientId).lastSeen(lastSeen);
    }

    private ClientIdentity reload(String clientId) {
        entityManager.clear();
        return repository.findById(clientId).orElseThrow();
    }
}
