package com.chicu.aiforecast.common.exception;

import lombok.Getter;

/**
 * Базовое исключение конвейера прогнозов: у каждого подкласса свой код ошибки для API.
 */
@Getter
public abstract class ForecastException extends RuntimeException {

    private final String errorCode;

    protected ForecastException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected ForecastException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();
}
