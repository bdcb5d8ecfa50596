package com.chicu.aiforecast.ai.ml.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Классификатор бандла. Вход: вектор в порядке схемы бандла.
 */
public interface ClassifierModel extends Serializable {

    /**
     * @return вероятность по каждому классу (сумма ≈ 1)
     */
    Map<String, Double> predictProba(double[] x);

    default ClassScore top(double[] x) {
        return ClassScore.top(predictProba(x));
    }
}
