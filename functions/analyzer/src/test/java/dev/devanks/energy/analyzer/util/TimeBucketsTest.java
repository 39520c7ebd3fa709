package dev.devanks.energy.analyzer.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TimeBuckets Unit Tests")
class TimeBucketsTest {

    @Test
    @DisplayName("hourOfWeek counts from Monday midnight")
    void hourOfWeek_mondayToSunday() {
        assertThat(TimeBuckets.hourOfWeek(Instant.parse("2024-01-22T00:10:00Z"), ZoneOffset.UTC)).isZero();
        assertThat(TimeBuckets.hourOfWeek(Instant.parse("2024-01-23T10:45:00Z"), ZoneOffset.UTC)).isEqualTo(34);
        assertThat(TimeBuckets.hourOfWeek(Instant.parse("2024-01-28T23:59:00Z"), ZoneOffset.UTC)).isEqualTo(167);
    }

    @Test
    @DisplayName("hourOfWeek uses local time of the zone")
    void hourOfWeek_localZone() {
        // 03:00 UTC Monday is still Sunday 22:00 in New York.
        assertThat(TimeBuckets.hourOfWeek(Instant.parse("2024-01-22T03:00:00Z"), ZoneId.of("America/New_York")))
                .isEqualTo(6 * 24 + 22);
    }
}
