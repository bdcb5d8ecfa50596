package com.chicu.aiforecast.common.enums;

import java.util.Locale;

/**
 * Действие, которое рекомендует модель.
 * Порядок важен: от самого бычьего к самому медвежьему.
 */
public enum TradeAction {
    STRONG_BUY,
    BUY,
    HOLD,
    SELL,
    STRONG_SELL;

    public boolean isBuy() {
        return this == STRONG_BUY || this == BUY;
    }

    public boolean isSell() {
        return this == STRONG_SELL || this == SELL;
    }

    /**
     * Разбор строки из модели/БД. Неизвестное значение: ошибка, а не HOLD по умолчанию.
     */
    public static TradeAction parse(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("action is blank");
        }
        return TradeAction.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
