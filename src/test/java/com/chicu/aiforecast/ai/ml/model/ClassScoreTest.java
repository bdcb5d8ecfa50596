package com.chicu.aiforecast.ai.ml.model;

import com.chicu.aiforecast.common.enums.TradeAction;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ClassScoreTest {

    @Test
    void topPicksHighestProbability() {
        Map<String, Double> p = new LinkedHashMap<>();
        p.put("HOLD", 0.2);
        p.put("BUY", 0.7);
        p.put("SELL", 0.1);

        ClassScore s = ClassScore.top(p);

        assertEquals("BUY", s.label());
        assertEquals(0.7, s.probability(), 1e-12);
    }

    @Test
    void tieResolvesToSmallerLabelRegardlessOfOrder() {
        Map<String, Double> a = new LinkedHashMap<>();
        a.put("UP", 0.5);
        a.put("DOWN", 0.5);
        Map<String, Double> b = new LinkedHashMap<>();
        b.put("DOWN", 0.5);
        b.put("UP", 0.5);

        assertEquals("DOWN", ClassScore.top(a).label());
        assertEquals("DOWN", ClassScore.top(b).label());
    }

    @Test
    void emptyScoresAreAnError() {
        assertThrows(IllegalStateException.class, () -> ClassScore.top(Map.of()));
    }

    @Test
    void baselineBundleHoldsAndAbstains() {
        double[] x = {1.0, 2.0, 3.0};

        ClassScore action = BaselineModels.constant(TradeAction.HOLD).top(x);
        ClassScore dir = BaselineModels.abstainingDirection().top(x);

        assertEquals("HOLD", action.label());
        assertEquals(1.0, action.probability(), 1e-12);
        assertEquals(0.5, dir.probability(), 1e-12);
        assertEquals(0.0, BaselineModels.zero().predict(x), 0.0);
    }

    @Test
    void directionLabelsMapBothWays() {
        assertEquals(1, DirectionLabels.toDirection(DirectionLabels.of(1)));
        assertEquals(-1, DirectionLabels.toDirection(DirectionLabels.of(-3)));
        assertThrows(IllegalArgumentException.class, () -> DirectionLabels.of(0));
        assertThrows(IllegalArgumentException.class, () -> DirectionLabels.toDirection("FLAT"));
    }
}
