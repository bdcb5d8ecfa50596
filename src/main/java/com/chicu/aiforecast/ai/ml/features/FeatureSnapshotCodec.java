package com.chicu.aiforecast.ai.ml.features;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

/**
 * JSON-кодек слепков фич. Даты пишутся ISO-строками, чтобы слепок читался глазами при разборе инцидентов.
 */
@Component
public class FeatureSnapshotCodec {

    private final ObjectMapper om;

    public FeatureSnapshotCodec(ObjectMapper objectMapper) {
        this.om = objectMapper.copy()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String encode(FeatureSnapshot snapshot) {
        try {
            return om.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("feature snapshot encode failed: " + e.getMessage(), e);
        }
    }

    public FeatureSnapshot decode(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("feature snapshot json is blank");
        }
        try {
            return om.readValue(json, FeatureSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("feature snapshot decode failed: " + e.getMessage(), e);
        }
    }
}
