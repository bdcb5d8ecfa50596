package com.chicu.aiforecast.ai.ml.model;

import java.util.Map;

/**
 * Класс с максимальной вероятностью. При равенстве: лексикографически меньший, чтобы результат был детерминирован.
 */
public record ClassScore(String label, double probability) {

    public static ClassScore top(Map<String, Double> proba) {
        if (proba == null || proba.isEmpty()) {
            throw new IllegalStateException("classifier returned no class scores");
        }
        String best = null;
        double bestP = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> e : proba.entrySet()) {
            double p = e.getValue() != null ? e.getValue() : 0.0;
            if (p > bestP || (p == bestP && best != null && e.getKey().compareTo(best) < 0)) {
                best = e.getKey();
                bestP = p;
            }
        }
        return new ClassScore(best, Math.max(0.0, Math.min(1.0, bestP)));
    }
}
