package com.chicu.aiforecast.ai.ml.model;

import com.chicu.aiforecast.ai.ml.features.FeatureSchema;
import com.chicu.aiforecast.ai.ml.training.HoldoutReport;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Версионированный набор из трёх оценщиков одной версии. Неизменяем;
 * движок читает его целиком одной ссылкой, поэтому смешать модели разных версий нельзя.
 */
@Getter
@ToString(of = {"version", "trainedFrom", "trainedTo", "holdout"})
public final class ModelBundle implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String version;
    private final FeatureSchema schema;
    private final ClassifierModel actionModel;
    private final ClassifierModel directionModel;
    private final RegressionModel magnitudeModel;

    /** Диапазон prediction_timestamp обучающих строк; null у baseline. */
    private final Instant trainedFrom;
    private final Instant trainedTo;

    private final HoldoutReport holdout;
    private final Instant createdAt;

    @Builder
    private ModelBundle(String version,
                        FeatureSchema schema,
                        ClassifierModel actionModel,
                        ClassifierModel directionModel,
                        RegressionModel magnitudeModel,
                        Instant trainedFrom,
                        Instant trainedTo,
                        HoldoutReport holdout,
                        Instant createdAt) {
        if (version == null || version.isBlank()) throw new IllegalArgumentException("version is blank");
        this.version = version.trim();
        this.schema = Objects.requireNonNull(schema, "schema");
        this.actionModel = Objects.requireNonNull(actionModel, "actionModel");
        this.directionModel = Objects.requireNonNull(directionModel, "directionModel");
        this.magnitudeModel = Objects.requireNonNull(magnitudeModel, "magnitudeModel");
        this.trainedFrom = trainedFrom;
        this.trainedTo = trainedTo;
        this.holdout = holdout != null ? holdout : HoldoutReport.empty();
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public ModelBundle withHoldout(HoldoutReport report) {
        return new ModelBundle(version, schema, actionModel, directionModel, magnitudeModel,
                trainedFrom, trainedTo, report, createdAt);
    }

    public boolean isBaseline() {
        return BaselineModels.BASELINE_VERSION.equals(version);
    }
}
