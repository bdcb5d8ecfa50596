package com.chicu.aiforecast.common.exception;

import lombok.Getter;

import java.time.Instant;

/**
 * Нет цены на запрошенный момент (выходной, дыра в истории, провайдер недоступен).
 * Никогда не подменяется ближайшей/устаревшей ценой.
 */
@Getter
public class MarketDataUnavailableException extends ForecastException {

    private final String symbol;
    private final Instant at;

    public MarketDataUnavailableException(String symbol, Instant at, String reason) {
        super("no market data symbol=" + symbol + " at=" + at + ": " + reason);
        this.symbol = symbol;
        this.at = at;
    }

    public MarketDataUnavailableException(String symbol, Instant at, String reason, Throwable cause) {
        super("no market data symbol=" + symbol + " at=" + at + ": " + reason, cause);
        this.symbol = symbol;
        this.at = at;
    }

    @Override
    protected String getDefaultErrorCode() {
        return "MARKET_DATA_UNAVAILABLE";
    }
}
