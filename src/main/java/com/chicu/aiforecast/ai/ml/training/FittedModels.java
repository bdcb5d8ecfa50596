package com.chicu.aiforecast.ai.ml.training;

import com.chicu.aiforecast.ai.ml.model.ClassifierModel;
import com.chicu.aiforecast.ai.ml.model.RegressionModel;

public record FittedModels(
        ClassifierModel action,
        ClassifierModel direction,
        RegressionModel magnitude
) {}
