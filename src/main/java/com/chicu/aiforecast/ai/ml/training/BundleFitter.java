package com.chicu.aiforecast.ai.ml.training;

import com.chicu.aiforecast.ai.ml.dataset.TrainingDatasetBuilder;

/**
 * Обучение трёх оценщиков бандла на одном датасете.
 */
public interface BundleFitter {

    FittedModels fit(TrainingDatasetBuilder.Dataset dataset);
}
