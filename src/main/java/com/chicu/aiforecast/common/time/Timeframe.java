package com.chicu.aiforecast.common.time;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Таймфрейм для бакетов прогнозов и горизонтов оценки.
 * Парсинг через словарь алиасов, без switch на строках.
 */
public enum Timeframe {
    M1(60, "1m"),
    M5(300, "5m"),
    M15(900, "15m"),
    M30(1800, "30m"),

    H1(3600, "1h"),
    H4(14400, "4h"),
    H12(43200, "12h"),

    D1(86400, "1d");

    private final int stepSeconds;
    private final String code;

    Timeframe(int stepSeconds, String code) {
        this.stepSeconds = stepSeconds;
        this.code = code;
    }

    public int getStepSeconds() {
        return stepSeconds;
    }

    /** Каноничный код: 1h, 4h, 1d ... */
    public String getCode() {
        return code;
    }

    public Duration toDuration() {
        return Duration.ofSeconds(stepSeconds);
    }

    public boolean isDaily() {
        return stepSeconds >= 86400;
    }

    // ---------- Разбор строк ----------

    private static final Map<String, Timeframe> LOOKUP;

    static {
        Map<String, Timeframe> m = new HashMap<>();

        putAll(m, M1, "1m", "1min", "1 minute");
        putAll(m, M5, "5m", "5min", "5 minutes");
        putAll(m, M15, "15m", "15min", "15 minutes");
        putAll(m, M30, "30m", "30min", "30 minutes");

        putAll(m, H1, "1h", "60m", "1hr", "1 hour");
        putAll(m, H4, "4h", "4hr", "4 hours");
        putAll(m, H12, "12h", "12hr", "12 hours");

        putAll(m, D1, "1d", "24h", "1day", "1 day");

        LOOKUP = Collections.unmodifiableMap(m);
    }

    private static String norm(String s) {
        return s == null ? null : s.trim().toLowerCase(Locale.ROOT).replace(" ", "");
    }

    private static void putAll(Map<String, Timeframe> m, Timeframe tf, String... keys) {
        for (String k : keys) {
            String n = norm(k);
            if (n != null && !n.isEmpty()) {
                m.put(n, tf);
            }
        }
        m.put(norm(tf.code), tf);
        m.put(norm(tf.name()), tf);
    }

    /**
     * В отличие от UI-парсинга, здесь нет безопасного дефолта:
     * неверный горизонт в конфиге должен ронять старт, а не молча подменяться.
     */
    public static Timeframe from(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("timeframe is blank");
        }
        Timeframe tf = LOOKUP.get(norm(s));
        if (tf == null) {
            throw new IllegalArgumentException("unknown timeframe: " + s);
        }
        return tf;
    }
}
