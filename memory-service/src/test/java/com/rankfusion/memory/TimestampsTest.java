package com.rankfusion.memory;

import com.rankfusion.memory.service.Timestamps;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampsTest {

    @Test
    void testParsesCommonShapes() {
        Instant expected = Instant.parse("2026-02-19T10:00:00Z");

        assertThat(Timestamps.parse("2026-02-19T10:00:00Z")).contains(expected);
        assertThat(Timestamps.parse("2026-02-19T11:00:00+01:00")).contains(expected);
        assertThat(Timestamps.parse("2026-02-19T10:00:00")).contains(expected);
        assertThat(Timestamps.parse("2026-02-19 10:00:00")).contains(expected);
        assertThat(Timestamps.parse("2026-02-19")).contains(Instant.parse("2026-02-19T00:00:00Z"));
    }

    @Test
    void testRejectsGarbage() {
        assertThat(Timestamps.parse(null)).isEmpty();
        assertThat(Timestamps.parse("  ")).isEmpty();
        assertThat(Timestamps.parse("last tuesday")).isEmpty();
    }

    @Test
    void testRejectsYearsOutsideCalendarRange() {
        assertThat(Timestamps.parse("+300000000-01-01T00:00:00Z")).isEmpty();
        assertThat(Timestamps.parse("+10000-01-01T00:00:00Z")).isEmpty();
        assertThat(Timestamps.parse("9999-12-31T23:59:59Z")).contains(Instant.parse("9999-12-31T23:59:59Z"));
        assertThat(Timestamps.parse("0001-01-01T00:00:00Z")).contains(Instant.parse("0001-01-01T00:00:00Z"));
    }
}
