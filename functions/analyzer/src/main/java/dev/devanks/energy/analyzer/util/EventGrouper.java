package dev.devanks.energy.analyzer.util;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Merges time-ordered flagged samples into contiguous events.
 */
public final class EventGrouper {

    private EventGrouper() {
    }

    /**
     * Two consecutive samples belong to the same event when they are at most {@code maxGap} apart
     * and {@code sameEvent} accepts them. Input must be sorted by timestamp.
     */
    public static <T> List<List<T>> group(List<T> samples, Function<T, Instant> timestamp, Duration maxGap,
                                          BiPredicate<T, T> sameEvent) {
        List<List<T>> events = new ArrayList<>();
        List<T> current = new ArrayList<>();
        T previous = null;
        for (T sample : samples) {
            if (previous != null) {
                var gap = Duration.between(timestamp.apply(previous), timestamp.apply(sample));
                if (gap.compareTo(maxGap) > 0 || !sameEvent.test(previous, sample)) {
                    events.add(current);
                    current = new ArrayList<>();
                }
            }
            current.add(sample);
            previous = sample;
        }
        if (!current.isEmpty()) {
            events.add(current);
        }
        return events;
    }
}
