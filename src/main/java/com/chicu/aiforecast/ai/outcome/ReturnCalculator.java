package com.chicu.aiforecast.ai.outcome;

/**
 * Фактическая доходность прогноза: (exit - entry) / entry * 100, направление: её знак.
 */
public final class ReturnCalculator {

    private ReturnCalculator() {
    }

    public static double returnPct(double entryPrice, double exitPrice) {
        if (!Double.isFinite(entryPrice) || entryPrice <= 0.0) {
            throw new IllegalArgumentException("entry price must be positive: " + entryPrice);
        }
        if (!Double.isFinite(exitPrice) || exitPrice <= 0.0) {
            throw new IllegalArgumentException("exit price must be positive: " + exitPrice);
        }
        return (exitPrice - entryPrice) / entryPrice * 100.0;
    }

    /** +1 / -1 / 0 */
    public static int direction(double returnPct) {
        return (int) Math.signum(returnPct);
    }
}
