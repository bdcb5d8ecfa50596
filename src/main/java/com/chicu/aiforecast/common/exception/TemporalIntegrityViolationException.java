package com.chicu.aiforecast.common.exception;

import com.chicu.aiforecast.ai.guard.AuditReport;
import lombok.Getter;

/**
 * Нарушен временной инвариант. Останавливает оценку и обучение до вмешательства оператора.
 */
@Getter
public class TemporalIntegrityViolationException extends ForecastException {

    private final transient AuditReport report;

    public TemporalIntegrityViolationException(String message, AuditReport report) {
        super(message);
        this.report = report;
    }

    @Override
    protected String getDefaultErrorCode() {
        return "TEMPORAL_INTEGRITY";
    }
}
