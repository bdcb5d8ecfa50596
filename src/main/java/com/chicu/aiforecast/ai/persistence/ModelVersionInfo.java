package com.chicu.aiforecast.ai.persistence;

import com.chicu.aiforecast.ai.ml.training.HoldoutReport;

import java.time.Instant;

/**
 * Строка истории реестра для операторов (без тела модели).
 */
public record ModelVersionInfo(
        String version,
        String schemaHash,
        String featureNames,
        Instant trainedFrom,
        Instant trainedTo,
        HoldoutReport holdout,
        boolean promoted,
        Instant createdAt,
        Instant promotedAt
) {
    public static ModelVersionInfo of(ModelArtifactEntity e) {
        return new ModelVersionInfo(
                e.getVersion(),
                e.getSchemaHash(),
                e.getFeatureNames(),
                e.getTrainedFrom(),
                e.getTrainedTo(),
                new HoldoutReport(e.getHoldoutRows(), e.getActionAccuracy(), e.getDirectionAccuracy(),
                        e.getDirectionCoverage(), e.getMagnitudeMae()),
                e.isPromoted(),
                e.getCreatedAt(),
                e.getPromotedAt()
        );
    }
}
