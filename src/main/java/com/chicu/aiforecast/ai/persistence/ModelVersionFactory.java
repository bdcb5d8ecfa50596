package com.chicu.aiforecast.ai.persistence;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.function.Predicate;

@Component
public class ModelVersionFactory {

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss'Z'").withZone(ZoneOffset.UTC);

    /**
     * Пример: forecast-2026-01-03T12-30-00Z, при коллизии в ту же секунду: forecast-...Z-2
     */
    public String build(Instant at, Predicate<String> exists) {
        String base = "forecast-" + TS.format(at);
        if (exists == null || !exists.test(base)) return base;
        for (int i = 2; i < 1000; i++) {
            String v = base + "-" + i;
            if (!exists.test(v)) return v;
        }
        throw new IllegalStateException("cannot allocate model version for " + base);
    }
}
