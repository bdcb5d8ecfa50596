package com.chicu.aiforecast.ai.ml.model;

import org.tribuo.Model;
import org.tribuo.Prediction;
import org.tribuo.classification.Label;
import org.tribuo.classification.LabelFactory;
import org.tribuo.impl.ArrayExample;

import java.io.Serial;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Обёртка над классификатором Tribuo: вектор в порядке схемы -> вероятности классов.
 */
public final class TribuoClassifierModel implements ClassifierModel {

    @Serial
    private static final long serialVersionUID = 1L;

    private final Model<Label> model;
    private final String[] featureNames;

    public TribuoClassifierModel(Model<Label> model, String[] featureNames) {
        if (model == null) throw new IllegalArgumentException("model=null");
        if (!model.generatesProbabilities()) {
            throw new IllegalArgumentException("classifier must produce probabilities: " + model.getName());
        }
        this.model = model;
        this.featureNames = featureNames.clone();
    }

    @Override
    public Map<String, Double> predictProba(double[] x) {
        if (x.length != featureNames.length) {
            throw new IllegalArgumentException("vector size " + x.length + " != " + featureNames.length);
        }
        Prediction<Label> p = model.predict(new ArrayExample<>(LabelFactory.UNKNOWN_LABEL, featureNames, x));
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, Label> e : p.getOutputScores().entrySet()) {
            out.put(e.getKey(), e.getValue().getScore());
        }
        return out;
    }

    @Override
    public String toString() {
        return "TribuoClassifierModel(" + model.getName() + ")";
    }
}
