package com.chicu.aiforecast.ai.ml.dataset;

import com.chicu.aiforecast.common.enums.TradeAction;

/**
 * Разметка действия по фактическому исходу. Только для обучения: при инференсе исход неизвестен.
 */
public interface ActionLabeler {

    TradeAction label(double actualReturnPct, double predictionConfidence);
}
