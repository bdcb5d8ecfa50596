package com.chicu.aiforecast.ai.ml.training;

import com.chicu.aiforecast.common.enums.TradeAction;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder
public record TrainingReport(
        TrainingStatus status,
        String reason,
        String modelVersion,             // версия кандидата (если дошли до обучения)
        String previousVersion,
        Instant cutoff,
        Instant startedAt,
        Instant finishedAt,
        int trainingRows,
        int holdoutRows,
        Map<TradeAction, Integer> actionCounts,
        Map<Integer, Integer> directionCounts,
        HoldoutReport candidate,
        HoldoutReport current
) {
    public boolean promoted() {
        return status == TrainingStatus.PROMOTED;
    }
}
