package com.chicu.aiforecast.ai.ml.training;

import com.chicu.aiforecast.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.aiforecast.ai.ml.model.DirectionLabels;
import com.chicu.aiforecast.ai.ml.model.TribuoClassifierModel;
import com.chicu.aiforecast.ai.ml.model.TribuoRegressionModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.tribuo.Model;
import org.tribuo.MutableDataset;
import org.tribuo.classification.Label;
import org.tribuo.classification.LabelFactory;
import org.tribuo.classification.sgd.objectives.LogMulticlass;
import org.tribuo.provenance.SimpleDataSourceProvenance;
import org.tribuo.impl.ArrayExample;
import org.tribuo.math.optimisers.AdaGrad;
import org.tribuo.regression.RegressionFactory;
import org.tribuo.regression.Regressor;
import org.tribuo.regression.sgd.objectives.SquaredLoss;

/**
 * Оценщики на Tribuo: логистическая регрессия (линейный SGD + LogMulticlass) для действия и направления,
 * линейная регрессия (SquaredLoss) для доходности. Фиксированный seed: повторяемое обучение.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TribuoBundleFitter implements BundleFitter {

    private static final String MAGNITUDE = "magnitude";

    private final TrainingProperties props;

    @Override
    public FittedModels fit(TrainingDatasetBuilder.Dataset dataset) {
        if (dataset == null || dataset.size() == 0) throw new IllegalArgumentException("dataset is empty");
        String[] names = dataset.schema().featureNames();

        LabelFactory labels = new LabelFactory();
        MutableDataset<Label> actionDs = new MutableDataset<>(
                new SimpleDataSourceProvenance("forecast-action:" + dataset.datasetId(), labels), labels);
        MutableDataset<Label> directionDs = new MutableDataset<>(
                new SimpleDataSourceProvenance("forecast-direction:" + dataset.datasetId(), labels), labels);

        RegressionFactory regressors = new RegressionFactory();
        MutableDataset<Regressor> magnitudeDs = new MutableDataset<>(
                new SimpleDataSourceProvenance("forecast-magnitude:" + dataset.datasetId(), regressors), regressors);

        for (TrainingDatasetBuilder.Row r : dataset.rows()) {
            actionDs.add(new ArrayExample<>(new Label(r.action().name()), names, r.x()));
            if (r.direction() != null) {
                directionDs.add(new ArrayExample<>(new Label(DirectionLabels.of(r.direction())), names, r.x()));
            }
            magnitudeDs.add(new ArrayExample<>(new Regressor(MAGNITUDE, r.returnPct()), names, r.x()));
        }

        long t0 = System.currentTimeMillis();

        Model<Label> action = classifierTrainer().train(actionDs);
        Model<Label> direction = classifierTrainer().train(directionDs);
        Model<Regressor> magnitude = regressionTrainer().train(magnitudeDs);

        log.info("🧠 FIT done dataset={} rows={} actionClasses={} directionRows={} tookMs={}",
                dataset.datasetId(), dataset.size(), actionDs.getOutputInfo().size(), directionDs.size(),
                System.currentTimeMillis() - t0);

        return new FittedModels(
                new TribuoClassifierModel(action, names),
                new TribuoClassifierModel(direction, names),
                new TribuoRegressionModel(magnitude, names)
        );
    }

    // новый тренер на каждый вызов: у тренера Tribuo внутренний счётчик запусков влияет на RNG
    private org.tribuo.classification.sgd.linear.LinearSGDTrainer classifierTrainer() {
        return new org.tribuo.classification.sgd.linear.LinearSGDTrainer(
                new LogMulticlass(), new AdaGrad(props.getLearningRate()), props.getEpochs(), props.getSeed());
    }

    private org.tribuo.regression.sgd.linear.LinearSGDTrainer regressionTrainer() {
        return new org.tribuo.regression.sgd.linear.LinearSGDTrainer(
                new SquaredLoss(), new AdaGrad(props.getLearningRate()), props.getEpochs(), props.getSeed());
    }
}
