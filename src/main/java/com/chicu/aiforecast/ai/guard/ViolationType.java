package com.chicu.aiforecast.ai.guard;

public enum ViolationType {

    // --- критичные ---
    LEAKAGE(Severity.CRITICAL),
    FUTURE_TIMESTAMP(Severity.CRITICAL),
    MIN_DELAY(Severity.CRITICAL),
    BACKDATED_PREDICTION(Severity.CRITICAL),
    EXIT_BEFORE_ENTRY(Severity.CRITICAL),

    // --- карантин ---
    DUPLICATE(Severity.HIGH),
    ORPHAN_OUTCOME(Severity.HIGH),
    RETURN_MISMATCH(Severity.HIGH),
    MALFORMED_SNAPSHOT(Severity.HIGH),

    // --- предупреждения ---
    EXTREME_RETURN(Severity.WARNING),
    EVALUATION_BACKLOG(Severity.WARNING),
    MODEL_HEALTH(Severity.WARNING),
    SIGNAL_CONTRADICTION(Severity.WARNING);

    private final Severity severity;

    ViolationType(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}
