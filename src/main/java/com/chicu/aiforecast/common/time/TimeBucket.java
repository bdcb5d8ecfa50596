package com.chicu.aiforecast.common.time;

import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Дискретный интервал, в котором допускается не более одного прогноза на символ.
 * Для дневного бакета граница: полночь в заданной зоне, для внутридневных: кратность шагу от эпохи.
 */
public final class TimeBucket {

    private TimeBucket() {
    }

    public static Instant startOf(Instant at, Timeframe bucket, ZoneId zone) {
        Objects.requireNonNull(at, "at");
        Objects.requireNonNull(bucket, "bucket");

        if (bucket.isDaily()) {
            ZoneId z = zone != null ? zone : ZoneId.of("UTC");
            return at.atZone(z).truncatedTo(ChronoUnit.DAYS).toInstant();
        }

        long step = bucket.getStepSeconds();
        long sec = at.getEpochSecond();
        return Instant.ofEpochSecond(Math.floorDiv(sec, step) * step);
    }
}
