package com.chicu.aiforecast.ai.ml.model;

import java.io.Serializable;

public interface RegressionModel extends Serializable {

    double predict(double[] x);
}
