package com.chicu.aiforecast.ai.ml.training;

import lombok.Builder;

import java.io.Serial;
import java.io.Serializable;

/**
 * Метрики бандла на отложенной выборке [cutoff, now).
 *
 * @param directionAccuracy точность только по строкам, где модель не воздержалась
 * @param directionCoverage доля строк, где модель дала направление
 */
@Builder
public record HoldoutReport(
        int rows,
        double actionAccuracy,
        double directionAccuracy,
        double directionCoverage,
        double magnitudeMae
) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public static HoldoutReport empty() {
        return new HoldoutReport(0, 0.0, 0.0, 0.0, 0.0);
    }
}
