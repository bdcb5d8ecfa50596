package com.chicu.aiforecast.ai.ml.model;

import org.tribuo.Model;
import org.tribuo.Prediction;
import org.tribuo.impl.ArrayExample;
import org.tribuo.regression.RegressionFactory;
import org.tribuo.regression.Regressor;

import java.io.Serial;

public final class TribuoRegressionModel implements RegressionModel {

    @Serial
    private static final long serialVersionUID = 1L;

    private final Model<Regressor> model;
    private final String[] featureNames;

    public TribuoRegressionModel(Model<Regressor> model, String[] featureNames) {
        if (model == null) throw new IllegalArgumentException("model=null");
        this.model = model;
        this.featureNames = featureNames.clone();
    }

    @Override
    public double predict(double[] x) {
        if (x.length != featureNames.length) {
            throw new IllegalArgumentException("vector size " + x.length + " != " + featureNames.length);
        }
        Prediction<Regressor> p = model.predict(
                new ArrayExample<>(RegressionFactory.UNKNOWN_REGRESSOR, featureNames, x));
        return p.getOutput().getValues()[0];
    }

    @Override
    public String toString() {
        return "TribuoRegressionModel(" + model.getName() + ")";
    }
}
