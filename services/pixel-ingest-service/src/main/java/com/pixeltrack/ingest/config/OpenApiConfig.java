package com.pixeltrack.ingest.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 *
 * Accessible at: /swagger-ui.html
 *
 * @author PixelTrack Platform Team
 * @since 1.0.0
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:pixel-ingest-service}")
    private String applicationName;

    @Value("${server.port:3001}")
    private String serverPort;

    @Bean
    public OpenAPI pixelIngestServiceOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("PixelTrack Ingest API")
                .version("1.0.0")
                .description("""
                    # PixelTrack Ingest Service

                    Receives behavioral events from the tracking pixel and stores them in PostgreSQL.

                    ## Endpoints

                    - **POST /events**: single event, validated, deduplicated and written atomically
                      together with a request metadata row
                    - **POST /events/bulk**: array of events, invalid and duplicate items are skipped,
                      all inserts share one transaction
                    - **POST /purchases**: legacy purchase body, stored as a `purchase` event
                    - **/users**, **/sessions**: explicit identity and session upserts

                    ## Responses

                    Validation failures return `400` with the failing codes:

                    ```json
                    {
                      "error": "invalid_event",
                      "errs": ["missing:client_id"],
                      "warns": ["recommend:session_id"]
                    }
                    ```

                    Storage failures return `500` with `{"error": "db_error"}`.
                    """)
                .contact(new Contact()
                    .name("PixelTrack Platform Team")
                    .email("platform-team@example.com")))
            .servers(List.of(
                new Server()
                    .url("http://localhost:" + serverPort)
                    .description("Local Development (" + applicationName + ")")
            ));
    }
}
