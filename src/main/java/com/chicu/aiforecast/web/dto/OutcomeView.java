package com.chicu.aiforecast.web.dto;

import com.chicu.aiforecast.ledger.PredictionOutcome;

import java.time.Instant;

public record OutcomeView(
        String outcomeId,
        String predictionId,
        String horizon,
        double entryPrice,
        double exitPrice,
        Instant entryAt,
        Instant exitAt,
        double actualReturnPct,
        int actualDirection,
        Instant evaluationTimestamp
) {
    public static OutcomeView of(PredictionOutcome o) {
        return new OutcomeView(
                o.getOutcomeId(),
                o.getPredictionId(),
                o.getHorizon(),
                o.getEntryPrice(),
                o.getExitPrice(),
                o.getEntryAt(),
                o.getExitAt(),
                o.getActualReturnPct(),
                o.getActualDirection(),
                o.getEvaluationTimestamp()
        );
    }
}
