package com.chicu.aiforecast.common.enums;

/**
 * Жизненный цикл прогноза: CREATED -> PENDING -> {EVALUATED | EXPIRED}.
 * Из терминальных состояний выхода нет.
 */
public enum PredictionStatus {
    CREATED,
    PENDING,
    EVALUATED,
    EXPIRED;

    public boolean isTerminal() {
        return this == EVALUATED || this == EXPIRED;
    }

    public boolean canTransitionTo(PredictionStatus next) {
        if (next == null || isTerminal()) return false;
        return switch (this) {
            case CREATED -> next == PENDING;
            case PENDING -> next == EVALUATED || next == EXPIRED;
            default -> false;
        };
    }
}
