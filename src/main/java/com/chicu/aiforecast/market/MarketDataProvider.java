package com.chicu.aiforecast.market;

import com.chicu.aiforecast.common.exception.MarketDataUnavailableException;

import java.time.Instant;

/**
 * Контракт рыночных данных. Отсутствие данных: всегда исключение, никогда не "ближайшая" цена.
 */
public interface MarketDataProvider {

    /**
     * @throws MarketDataUnavailableException нет цены на этот момент или провайдер недоступен
     */
    PricePoint closeAt(String symbol, Instant at);
}
