package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.dto.PixelEventRequest;

import java.util.function.Function;

/**
 * Top-level marketing parameters older pixels send instead of a structured
 * {@code campaign} object. Declaration order is the key order of the
 * synthesized campaign.
 */
public enum LegacyAttributionField {
    UTM_SOURCE("utm_source", PixelEventRequest::getUtmSource),
    UTM_MEDIUM("utm_medium", PixelEventRequest::getUtmMedium),
    UTM_CAMPAIGN("utm_campaign", PixelEventRequest::getUtmCampaign),
    UTM_CONTENT("utm_content", PixelEventRequest::getUtmContent),
    UTM_TERM("utm_term", PixelEventRequest::getUtmTerm),
    GCLID("gclid", PixelEventRequest::getGclid),
    FBCLID("fbclid", PixelEventRequest::getFbclid),
    WBRAID("wbraid", PixelEventRequest::getWbraid),
    GBRAID("gbraid", PixelEventRequest::getGbraid),
    MSCLKID("msclkid", PixelEventRequest::getMsclkid),
    TTCLID("ttclid", PixelEventRequest::getTtclid),
    YCLID("yclid", PixelEventRequest::getYclid);

    private final String fieldName;
    private final Function<PixelEventRequest, String> accessor;

    LegacyAttributionField(String fieldName, Function<PixelEventRequest, String> accessor) {
        this.fieldName = fieldName;
        this.accessor = accessor;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String valueOf(PixelEventRequest event) {
        return accessor.apply(event);
    }
}
