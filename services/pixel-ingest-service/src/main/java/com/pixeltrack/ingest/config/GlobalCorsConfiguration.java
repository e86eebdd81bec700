package com.pixeltrack.ingest.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Global CORS configuration.
 *
 * The pixel script is embedded on arbitrary customer sites, so by default every
 * origin may POST events. Origins, methods and headers come from
 * {@code pixel.ingest.cors.*}.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class GlobalCorsConfiguration implements WebMvcConfigurer {

    private final IngestionProperties properties;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        IngestionProperties.Cors cors = properties.getCors();
        if (!cors.isEnabled()) {
            log.info("CORS is disabled globally");
            return;
        }

        log.info("Configuring global CORS: origins={}, methods={}",
                cors.getAllowedOrigins(), cors.getAllowedMethods());

        registry.addMapping("/**")
                .allowedOriginPatterns(cors.getAllowedOrigins().toArray(String[]::new))
                .allowedMethods(cors.getAllowedMethods().toArray(String[]::new))
                .allowedHeaders(cors.getAllowedHeaders().toArray(String[]::new))
                .maxAge(cors.getMaxAge());
    }
}
