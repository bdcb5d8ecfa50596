package com.chicu.aiforecast.ai.guard;

/**
 * Одна находка аудита. predictionId/outcomeId: null для агрегатных проверок.
 */
public record Violation(
        ViolationType type,
        Severity severity,
        String predictionId,
        String outcomeId,
        String message
) {
    public static Violation of(ViolationType type, String predictionId, String outcomeId, String message) {
        return new Violation(type, type.getSeverity(), predictionId, outcomeId, message);
    }

    public static Violation aggregate(ViolationType type, String message) {
        return new Violation(type, type.getSeverity(), null, null, message);
    }
}
