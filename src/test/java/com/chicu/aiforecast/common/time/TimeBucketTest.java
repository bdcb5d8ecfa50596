package com.chicu.aiforecast.common.time;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class TimeBucketTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    void dailyBucket_startsAtMidnightOfZone() {
        Instant at = Instant.parse("2026-03-02T14:37:12Z");
        assertEquals(Instant.parse("2026-03-02T00:00:00Z"), TimeBucket.startOf(at, Timeframe.D1, UTC));

        // в Москве (+3) 23:30 UTC: уже следующие сутки
        Instant late = Instant.parse("2026-03-02T23:30:00Z");
        assertEquals(Instant.parse("2026-03-02T21:00:00Z"),
                TimeBucket.startOf(late, Timeframe.D1, ZoneId.of("Europe/Moscow")));
    }

    @Test
    void intradayBucket_isMultipleOfStep() {
        Instant at = Instant.parse("2026-03-02T14:37:12Z");
        assertEquals(Instant.parse("2026-03-02T12:00:00Z"), TimeBucket.startOf(at, Timeframe.H4, UTC));
        assertEquals(Instant.parse("2026-03-02T14:00:00Z"), TimeBucket.startOf(at, Timeframe.H1, UTC));
    }

    @Test
    void sameBucket_forTwoTimesInsideOneDay() {
        Instant a = Instant.parse("2026-03-02T00:00:00Z");
        Instant b = Instant.parse("2026-03-02T23:59:59Z");
        assertEquals(TimeBucket.startOf(a, Timeframe.D1, UTC), TimeBucket.startOf(b, Timeframe.D1, UTC));
        assertNotEquals(TimeBucket.startOf(b, Timeframe.D1, UTC),
                TimeBucket.startOf(b.plusSeconds(1), Timeframe.D1, UTC));
    }
}
