package com.openclaw.wechat.common.infra;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormatAgeTest {

    @Test
    void formatAge_justNow() {
        assertEquals("just now", FormatAge.formatAge(0));
        assertEquals("just now", FormatAge.formatAge(59_999));
        assertEquals("just now", FormatAge.formatAge(-5));
    }

    @Test
    void formatAge_minutesTruncate() {
        assertEquals("1m ago", FormatAge.formatAge(60_000));
        assertEquals("5m ago", FormatAge.formatAge(5 * 60_000 + 59_000));
        assertEquals("59m ago", FormatAge.formatAge(59 * 60_000 + 59_999));
    }

    @Test
    void formatAge_hours() {
        assertEquals("1h ago", FormatAge.formatAge(3_600_000));
        assertEquals("23h ago", FormatAge.formatAge(24 * 3_600_000L - 1));
    }

    @Test
    void formatAge_days() {
        assertEquals("1d ago", FormatAge.formatAge(24 * 3_600_000L));
        assertEquals("2d ago", FormatAge.formatAge(71 * 3_600_000L));
    }

    @Test
    void formatElapsed_units() {
        assertEquals("45s", FormatAge.formatElapsed(45_000, 0));
        assertEquals("5m", FormatAge.formatElapsed(330_000, 0));
        assertEquals("3h", FormatAge.formatElapsed(3 * 3_600_000L + 1, 0));
        assertEquals("2d", FormatAge.formatElapsed(49 * 3_600_000L, 0));
        assertNull(FormatAge.formatElapsed(0, 1));
    }
}
