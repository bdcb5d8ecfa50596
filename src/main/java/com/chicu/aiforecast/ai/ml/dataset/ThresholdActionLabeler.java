package com.chicu.aiforecast.ai.ml.dataset;

import com.chicu.aiforecast.ai.ml.training.TrainingProperties;
import com.chicu.aiforecast.common.enums.TradeAction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Ступенчатые пороги доходности. STRONG_*: только если исходный прогноз был уверенным.
 * Пороги берутся из forecast.training.*.
 */
@Service
@RequiredArgsConstructor
public class ThresholdActionLabeler implements ActionLabeler {

    private final TrainingProperties props;

    @Override
    public TradeAction label(double actualReturnPct, double predictionConfidence) {
        if (!Double.isFinite(actualReturnPct)) {
            throw new IllegalArgumentException("return is not finite: " + actualReturnPct);
        }
        boolean confident = predictionConfidence > props.getStrongMinConfidence();

        if (actualReturnPct > props.getStrongReturnPct() && confident) return TradeAction.STRONG_BUY;
        if (actualReturnPct > props.getReturnPct()) return TradeAction.BUY;
        if (actualReturnPct < -props.getStrongReturnPct() && confident) return TradeAction.STRONG_SELL;
        if (actualReturnPct < -props.getReturnPct()) return TradeAction.SELL;
        return TradeAction.HOLD;
    }
}
