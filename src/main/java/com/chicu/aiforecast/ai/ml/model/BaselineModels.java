package com.chicu.aiforecast.ai.ml.model;

import com.chicu.aiforecast.common.enums.TradeAction;

import java.io.Serial;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Стартовые модели для пустого реестра: HOLD, направление воздерживается, доходность 0.
 * Нужны, чтобы конвейер набрал первые исходы до первого обучения.
 */
public final class BaselineModels {

    public static final String BASELINE_VERSION = "baseline-v0";

    private BaselineModels() {
    }

    public static ClassifierModel constant(TradeAction action) {
        Map<String, Double> p = new LinkedHashMap<>();
        p.put(action.name(), 1.0);
        return new ConstantClassifier(p);
    }

    /** Равные шансы UP/DOWN: топ-вероятность 0.5, ниже любого разумного порога воздержания. */
    public static ClassifierModel abstainingDirection() {
        Map<String, Double> p = new LinkedHashMap<>();
        p.put(DirectionLabels.UP, 0.5);
        p.put(DirectionLabels.DOWN, 0.5);
        return new ConstantClassifier(p);
    }

    public static RegressionModel zero() {
        return new ConstantRegressor(0.0);
    }

    record ConstantClassifier(Map<String, Double> proba) implements ClassifierModel {
        @Serial
        private static final long serialVersionUID = 1L;

        ConstantClassifier {
            proba = new LinkedHashMap<>(proba);
        }

        @Override
        public Map<String, Double> predictProba(double[] x) {
            return new LinkedHashMap<>(proba);
        }
    }

    record ConstantRegressor(double value) implements RegressionModel {
        @Serial
        private static final long serialVersionUID = 1L;

        @Override
        public double predict(double[] x) {
            return value;
        }
    }
}
