package com.chicu.aiforecast.web.dto;

import com.chicu.aiforecast.common.enums.PredictionStatus;
import com.chicu.aiforecast.common.enums.TradeAction;
import com.chicu.aiforecast.ledger.PredictionRecord;

import java.time.Instant;

public record PredictionView(
        String predictionId,
        String symbol,
        Instant bucketStart,
        Instant predictionTimestamp,
        TradeAction predictedAction,
        double actionConfidence,
        Integer predictedDirection,
        double predictedMagnitude,
        String featureSnapshot,
        String schemaHash,
        String modelVersion,
        Instant createdAt,
        PredictionStatus status
) {
    public static PredictionView of(PredictionRecord p, PredictionStatus status) {
        return new PredictionView(
                p.getPredictionId(),
                p.getSymbol(),
                p.getBucketStart(),
                p.getPredictionTimestamp(),
                p.getPredictedAction(),
                p.getActionConfidence(),
                p.getPredictedDirection(),
                p.getPredictedMagnitude(),
                p.getFeaturesJson(),
                p.getSchemaHash(),
                p.getModelVersion(),
                p.getCreatedAt(),
                status
        );
    }
}
