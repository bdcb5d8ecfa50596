package com.chicu.aiforecast.ai.ml.training;

import com.chicu.aiforecast.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.aiforecast.ai.ml.model.ClassScore;
import com.chicu.aiforecast.ai.ml.model.DirectionLabels;
import com.chicu.aiforecast.ai.ml.model.ModelBundle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Метрики бандла на отложенной выборке. Тот же порог воздержания по направлению, что и в инференсе.
 */
@Component
@RequiredArgsConstructor
public class HoldoutEvaluator {

    private final TrainingProperties props;

    public HoldoutReport evaluate(ModelBundle bundle, TrainingDatasetBuilder.Dataset holdout) {
        if (holdout == null || holdout.size() == 0) return HoldoutReport.empty();
        if (!bundle.getSchema().equals(holdout.schema())) {
            throw new IllegalArgumentException("holdout schema " + holdout.schema()
                    + " != bundle schema " + bundle.getSchema() + " version=" + bundle.getVersion());
        }

        int n = holdout.size();
        int actionHits = 0;
        int dirRows = 0;
        int dirCovered = 0;
        int dirHits = 0;
        double absErr = 0.0;

        for (TrainingDatasetBuilder.Row r : holdout.rows()) {
            ClassScore a = bundle.getActionModel().top(r.x());
            if (r.action().name().equals(a.label())) actionHits++;

            if (r.direction() != null) {
                dirRows++;
                ClassScore d = bundle.getDirectionModel().top(r.x());
                if (d.probability() >= props.getDirectionAbstainBelow()) {
                    dirCovered++;
                    if (DirectionLabels.toDirection(d.label()) == r.direction()) dirHits++;
                }
            }

            absErr += Math.abs(bundle.getMagnitudeModel().predict(r.x()) - r.returnPct());
        }

        return HoldoutReport.builder()
                .rows(n)
                .actionAccuracy((double) actionHits / n)
                .directionAccuracy(dirCovered > 0 ? (double) dirHits / dirCovered : 0.0)
                .directionCoverage(dirRows > 0 ? (double) dirCovered / dirRows : 0.0)
                .magnitudeMae(absErr / n)
                .build();
    }
}
