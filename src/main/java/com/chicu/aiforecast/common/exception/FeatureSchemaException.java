package com.chicu.aiforecast.common.exception;

/**
 * Вектор фич не совпадает со схемой продвинутой модели. Ничего не записывается.
 */
public class FeatureSchemaException extends ForecastException {

    public FeatureSchemaException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "FEATURE_SCHEMA";
    }
}
