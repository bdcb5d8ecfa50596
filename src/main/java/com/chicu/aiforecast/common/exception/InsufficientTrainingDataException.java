package com.chicu.aiforecast.common.exception;

/**
 * Слишком мало строк (или классов) для обучения. Ничего не продвигается.
 */
public class InsufficientTrainingDataException extends ForecastException {

    public InsufficientTrainingDataException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "INSUFFICIENT_TRAINING_DATA";
    }
}
