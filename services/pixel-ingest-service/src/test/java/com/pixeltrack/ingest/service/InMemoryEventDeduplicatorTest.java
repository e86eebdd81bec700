package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.config.IngestionProperties;
import com.pixeltrack.ingest.dto.PixelEventRequest;
import com.pixeltrack.ingest.support.MutableClock;
import com.pixeltrack.ingest.support.TestEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryEventDeduplicator Unit Tests")
class InMemoryEventDeduplicatorTest {

    private MutableClock clock;
    private InMemoryEventDeduplicator deduplicator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        IngestionProperties properties = new IngestionProperties();
        properties.getDedupe().setWindow(Duration.ofSeconds(60));
        deduplicator = new InMemoryEventDeduplicator(clock, properties);
    }

    @Test
    @DisplayName("Should store the first submission and suppress a repeat within the window")
    void shouldSuppressRepeatWithinWindow() {
        PixelEventRequest event = TestEvents.pageView("e-1");

        assertThat(deduplicator.shouldStore(event)).isTrue();
        clock.advance(Duration.ofSeconds(30));
        assertThat(deduplicator.shouldStore(event)).isFalse();
    }

    @Test
    @DisplayName("Should store again once the window has passed")
    void shouldStoreAfterWindow() {
        PixelEventRequest event = TestEvents.pageView("e-1");

        assertThat(deduplicator.shouldStore(event)).isTrue();
        clock.advance(Duration.ofSeconds(61));
        assertThat(deduplicator.shouldStore(event)).isTrue();
    }

    @Test
    @DisplayName("Should still suppress at exactly the window age")
    void shouldSuppressAtWindowBoundary() {
        PixelEventRequest event = TestEvents.pageView("e-1");

        deduplicator.shouldStore(event);
        clock.advance(Duration.ofSeconds(60));

        assertThat(deduplicator.shouldStore(event)).isFalse();
    }

    @Test
    @DisplayName("Should ignore payload content and key on name plus id")
    void shouldKeyOnFingerprintOnly() {
        PixelEventRequest first = TestEvents.pageView("e-1");
        PixelEventRequest sameIdOtherPage = TestEvents.pageView("e-1");
        sameIdOtherPage.setPageLocation("https://shop.example.com/b");
        PixelEventRequest sameIdOtherName = TestEvents.pageView("e-1");
        sameIdOtherName.setEventName("click");

        assertThat(deduplicator.shouldStore(first)).isTrue();
        assertThat(deduplicator.shouldStore(sameIdOtherPage)).isFalse();
        assertThat(deduplicator.shouldStore(sameIdOtherName)).isTrue();
    }

    @Test
    @DisplayName("Should evict expired fingerprints on the next check")
    void shouldEvictExpiredEntries() {
        deduplicator.shouldStore(TestEvents.pageView("e-1"));
        deduplicator.shouldStore(TestEvents.pageView("e-2"));
        assertThat(deduplicator.size()).isEqualTo(2);

        clock.advance(Duration.ofMinutes(5));
        deduplicator.shouldStore(TestEvents.pageView("e-3"));

        assertThat(deduplicator.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should accept exactly one of many concurrent identical submissions")
    void shouldAcceptOneConcurrentSubmission() throws Exception {
        // Given
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Callable<Boolean>> submissions = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            submissions.add(() -> deduplicator.shouldStore(TestEvents.pageView("e-race")));
        }

        // When
        int accepted = 0;
        try {
            for (Future<Boolean> future : executor.invokeAll(submissions)) {
                if (future.get()) {
                    accepted++;
                }
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(accepted).isEqualTo(1);
    }

    @Test
    @DisplayName("Should forget everything on clear")
    void shouldClear() {
        deduplicator.shouldStore(TestEvents.pageView("e-1"));

        deduplicator.clear();

        assertThat(deduplicator.size()).isZero();
        assertThat(deduplicator.shouldStore(TestEvents.pageView("e-1"))).isTrue();
    }
}
