package com.chicu.aiforecast.ai.ml.features;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Вход от внешнего поставщика фич: символ, момент сбора и именованные значения.
 *
 * @param observedAt когда наблюдалось каждое значение; пусто: всё наблюдалось в collectedAt
 */
public record FeatureVector(
        String symbol,
        Instant collectedAt,
        Map<String, Double> values,
        Map<String, Instant> observedAt
) {
    public FeatureVector {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        observedAt = observedAt == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(observedAt));
    }

    public static FeatureVector of(String symbol, Instant collectedAt, Map<String, Double> values) {
        return new FeatureVector(symbol, collectedAt, values, Map.of());
    }

    public Instant observedAtOf(String feature) {
        Instant t = observedAt.get(feature);
        return t != null ? t : collectedAt;
    }
}
