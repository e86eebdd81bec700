package com.pixeltrack.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("com.pixeltrack.ingest.config")
public class PixelIngestServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(PixelIngestServiceApplication.class, args);
    }
}
