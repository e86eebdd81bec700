package com.pixeltrack.ingest.exception;

public class ResourceNotFoundException extends PixelIngestException {

    public ResourceNotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
    }
}
