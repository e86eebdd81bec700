package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.dto.PixelEventRequest;
import com.pixeltrack.ingest.model.ValidationCode;
import com.pixeltrack.ingest.model.ValidationResult;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks required identifiers and event-specific rules. Stateless.
 */
@Component
public class PixelEventValidator {

    static final String PURCHASE_EVENT = "purchase";

    public ValidationResult validate(PixelEventRequest event) {
        List<ValidationCode> errors = new ArrayList<>();
        List<ValidationCode> warnings = new ArrayList<>();

        if (!StringUtils.hasText(event.getEventId())) {
            errors.add(ValidationCode.MISSING_EVENT_ID);
        }
        if (!StringUtils.hasText(event.getEventName())) {
            errors.add(ValidationCode.MISSING_EVENT_NAME);
        }
        if (!StringUtils.hasText(event.getClientId())) {
            errors.add(ValidationCode.MISSING_CLIENT_ID);
        }
        if (!StringUtils.hasText(event.getSessionId())) {
            warnings.add(ValidationCode.RECOMMEND_SESSION_ID);
        }

        if (PURCHASE_EVENT.equals(event.getEventName())) {
            Map<String, Object> ecommerce = event.getEcommerce() == null ? Map.of() : event.getEcommerce();
            if (!(ecommerce.get("value") instanceof Number)) {
                errors.add(ValidationCode.MISSING_ECOMMERCE_VALUE);
            }
            if (!(ecommerce.get("currency") instanceof String)) {
                errors.add(ValidationCode.MISSING_ECOMMERCE_CURRENCY);
            }
        }

        return new ValidationResult(errors, warnings);
    }
}
