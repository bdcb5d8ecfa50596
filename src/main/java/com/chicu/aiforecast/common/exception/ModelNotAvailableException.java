package com.chicu.aiforecast.common.exception;

/**
 * В реестре нет продвинутого бандла (или его не удалось загрузить).
 */
public class ModelNotAvailableException extends ForecastException {

    public ModelNotAvailableException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "MODEL_NOT_AVAILABLE";
    }
}
