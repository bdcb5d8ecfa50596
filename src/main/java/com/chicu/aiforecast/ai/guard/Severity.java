package com.chicu.aiforecast.ai.guard;

/**
 * CRITICAL: стоп оценки и обучения; HIGH: строки в карантин; WARNING: только в отчёт.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    WARNING
}
