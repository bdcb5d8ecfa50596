package com.chicu.aiforecast.common.time;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TimeframeTest {

    @Test
    void from_shouldAcceptCodesAliasesAndEnumNames() {
        assertEquals(Timeframe.H1, Timeframe.from("1h"));
        assertEquals(Timeframe.H1, Timeframe.from("60m"));
        assertEquals(Timeframe.H4, Timeframe.from(" 4 Hours "));
        assertEquals(Timeframe.D1, Timeframe.from("24h"));
        assertEquals(Timeframe.D1, Timeframe.from("d1"));
    }

    @Test
    void from_shouldFailOnUnknownOrBlank_insteadOfSilentDefault() {
        assertThrows(IllegalArgumentException.class, () -> Timeframe.from("7x"));
        assertThrows(IllegalArgumentException.class, () -> Timeframe.from(" "));
        assertThrows(IllegalArgumentException.class, () -> Timeframe.from(null));
    }

    @Test
    void toDuration_andDailyFlag() {
        assertEquals(Duration.ofHours(4), Timeframe.H4.toDuration());
        assertTrue(Timeframe.D1.isDaily());
        assertFalse(Timeframe.H12.isDaily());
        assertEquals("1d", Timeframe.D1.getCode());
    }
}
