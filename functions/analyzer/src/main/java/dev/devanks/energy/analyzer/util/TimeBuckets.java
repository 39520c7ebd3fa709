package dev.devanks.energy.analyzer.util;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

public final class TimeBuckets {

    /**
     * Single bucket used when readings are grouped as one population.
     */
    public static final int ALL = -1;

    public static final int HOURS_PER_WEEK = 168;

    private TimeBuckets() {
    }

    /**
     * 0 = Monday 00:00-00:59 ... 167 = Sunday 23:00-23:59, in the given zone.
     */
    public static int hourOfWeek(Instant instant, ZoneId zone) {
        ZonedDateTime local = instant.atZone(zone);
        return (local.getDayOfWeek().getValue() - 1) * 24 + local.getHour();
    }
}
