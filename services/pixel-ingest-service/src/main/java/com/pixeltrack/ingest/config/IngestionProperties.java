package com.pixeltrack.ingest.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pixel ingestion settings bound from {@code pixel.ingest.*}.
 *
 * <pre>
 * pixel:
 *   ingest:
 *     dedupe:
 *       window: 60s
 *     request:
 *       forwarded-for-header: X-Forwarded-For
 *       request-id-header: X-Request-Id
 *     cors:
 *       allowed-origins: "*"
 * </pre>
 *
 * @author PixelTrack Platform Team
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "pixel.ingest")
public class IngestionProperties {

    @Valid
    @NotNull
    private Dedupe dedupe = new Dedupe();

    @Valid
    @NotNull
    private Request request = new Request();

    @Valid
    @NotNull
    private Cors cors = new Cors();

    @Data
    public static class Dedupe {

        /**
         * How long an (event_name, event_id) fingerprint suppresses resubmissions.
         */
        @NotNull
        private Duration window = Duration.ofSeconds(60);
    }

    @Data
    public static class Request {

        @NotBlank
        private String forwardedForHeader = "X-Forwarded-For";

        @NotBlank
        private String requestIdHeader = "X-Request-Id";
    }

    @Data
    public static class Cors {

        private boolean enabled = true;

        @NotEmpty
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        @NotEmpty
        private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "OPTIONS"));

        @NotEmpty
        private List<String> allowedHeaders = new ArrayList<>(List.of("Content-Type", "Authorization"));

        @Min(0)
        private long maxAge = 3600;
    }
}
