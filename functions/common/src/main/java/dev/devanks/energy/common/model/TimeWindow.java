package dev.devanks.energy.common.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Half-open time interval [start, end).
 */
@Value
public class TimeWindow {

    Instant start;
    Instant end;

    public TimeWindow(Instant start, Instant end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Window start must be before end: [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public Duration getDuration() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    /**
     * Splits [start, end) into consecutive windows of {@code size}; the last one is truncated at {@code end}.
     * An empty or inverted range yields no windows.
     */
    public static List<TimeWindow> partition(Instant start, Instant end, Duration size) {
        if (size.isZero() || size.isNegative()) {
            throw new IllegalArgumentException("Window size must be positive, got " + size);
        }
        List<TimeWindow> windows = new ArrayList<>();
        Instant cursor = start;
        while (cursor.isBefore(end)) {
            Instant next = cursor.plus(size);
            if (next.isAfter(end)) {
                next = end;
            }
            windows.add(new TimeWindow(cursor, next));
            cursor = next;
        }
        return windows;
    }
}
