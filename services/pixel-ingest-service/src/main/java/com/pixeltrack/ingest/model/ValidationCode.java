package com.pixeltrack.ingest.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Error and warning codes reported back to the pixel.
 */
public enum ValidationCode {
    MISSING_EVENT_ID("missing:event_id"),
    MISSING_EVENT_NAME("missing:event_name"),
    MISSING_CLIENT_ID("missing:client_id"),
    MISSING_ECOMMERCE_VALUE("missing:ecommerce.value"),
    MISSING_ECOMMERCE_CURRENCY("missing:ecommerce.currency"),
    INVALID_PAYLOAD("invalid:payload"),
    RECOMMEND_SESSION_ID("recommend:session_id");

    private final String code;

    ValidationCode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
