package com.pixeltrack.ingest.exception;

/**
 * Base exception for pixel ingestion errors that are not part of the
 * pipeline's structured outcomes.
 */
public class PixelIngestException extends RuntimeException {

    public PixelIngestException(String message) {
        super(message);
    }

    public PixelIngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
