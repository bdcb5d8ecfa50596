package com.chicu.aiforecast.common.exception;

import lombok.Getter;

import java.time.Instant;

/**
 * Прогноз для (symbol, bucket) уже есть. Не фатально: вызывающий считает интервал закрытым.
 */
@Getter
public class DuplicatePredictionException extends ForecastException {

    private final String symbol;
    private final Instant bucketStart;

    public DuplicatePredictionException(String symbol, Instant bucketStart, Throwable cause) {
        super("prediction already exists symbol=" + symbol + " bucket=" + bucketStart, cause);
        this.symbol = symbol;
        this.bucketStart = bucketStart;
    }

    @Override
    protected String getDefaultErrorCode() {
        return "DUPLICATE_PREDICTION";
    }
}
