package com.chicu.aiforecast.ai.ml.features;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Слепок фич, сохраняемый в прогнозе дословно (для аудита утечек и для обучения).
 */
public record FeatureSnapshot(
        String schemaHash,
        Instant collectedAt,
        Map<String, Double> values,
        Map<String, Instant> observedAt
) {
    public static FeatureSnapshot of(FeatureVector fv, FeatureSchema schema) {
        Map<String, Double> values = new LinkedHashMap<>();
        Map<String, Instant> observed = new LinkedHashMap<>();
        for (String name : schema.featureNames()) {
            values.put(name, fv.values().get(name));
            observed.put(name, fv.observedAtOf(name));
        }
        return new FeatureSnapshot(schema.schemaHash(), fv.collectedAt(), values, observed);
    }

    /** Самый поздний момент наблюдения среди фич слепка. */
    public Instant latestObservation() {
        Instant latest = collectedAt;
        if (observedAt != null) {
            for (Instant t : observedAt.values()) {
                if (t != null && (latest == null || t.isAfter(latest))) latest = t;
            }
        }
        return latest;
    }
}
