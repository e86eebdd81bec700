package com.pixeltrack.ingest.service;

import com.pixeltrack.ingest.dto.PixelEventRequest;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves the structured campaign of an event, falling back to the legacy
 * flat attribution parameters.
 */
@Component
public class LegacyCampaignMapper {

    /**
     * @return the event's own campaign when present (even if empty), else a map
     *         of the non-null legacy fields keyed by their wire names, else null
     */
    public Map<String, Object> resolveCampaign(PixelEventRequest event) {
        if (event.getCampaign() != null) {
            return event.getCampaign();
        }

        Map<String, Object> campaign = new LinkedHashMap<>();
        for (LegacyAttributionField field : LegacyAttributionField.values()) {
            String value = field.valueOf(event);
            if (value != null) {
                campaign.put(field.getFieldName(), value);
            }
        }
        return campaign.isEmpty() ? null : campaign;
    }
}
