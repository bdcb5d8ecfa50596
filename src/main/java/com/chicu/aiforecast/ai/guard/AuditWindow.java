package com.chicu.aiforecast.ai.guard;

import java.time.Instant;

/**
 * Окно аудита по prediction_timestamp: [from, to). null с любой стороны: без границы.
 */
public record AuditWindow(Instant from, Instant to) {

    /** Верхняя граница "без ограничения", которую понимают и H2, и Postgres. */
    static final Instant FAR_FUTURE = Instant.parse("9999-12-31T00:00:00Z");

    public AuditWindow {
        if (from != null && to != null && !from.isBefore(to)) {
            throw new IllegalArgumentException("audit window is empty: from=" + from + " to=" + to);
        }
    }

    public static AuditWindow all() {
        return new AuditWindow(null, null);
    }

    public static AuditWindow since(Instant from) {
        return new AuditWindow(from, null);
    }

    public Instant effectiveFrom() {
        return from != null ? from : Instant.EPOCH;
    }

    public Instant effectiveTo() {
        return to != null ? to : FAR_FUTURE;
    }
}
