package dev.devanks.energy.common.service;

import dev.devanks.energy.common.model.IngestionGap;
import dev.devanks.energy.common.model.IngestionRun;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Computes which parts of a range are covered by successful ingestion runs.
 */
public final class IngestionCoverage {

    /**
     * Slack allowed between the end of one successful run and the start of the next.
     */
    public static final Duration DEFAULT_TOLERANCE = Duration.ofMinutes(5);

    private IngestionCoverage() {
    }

    /**
     * Returns the sub-intervals of [start, end) not covered by any {@code SUCCESS} run, in order.
     * Failed runs are ignored. Holes no longer than {@code tolerance} are not reported.
     */
    public static List<IngestionGap> findGaps(String channelId, Collection<IngestionRun> runs,
                                              Instant start, Instant end, Duration tolerance) {
        List<IngestionGap> gaps = new ArrayList<>();
        if (!start.isBefore(end)) {
            return gaps;
        }
        var successes = runs.stream()
                .filter(IngestionRun::isSuccess)
                .sorted(Comparator.comparing(IngestionRun::getWindowStart))
                .toList();

        Instant cursor = start;
        for (IngestionRun run : successes) {
            if (!run.getWindowStart().isBefore(end)) {
                break;
            }
            if (!run.getWindowEnd().isAfter(cursor)) {
                continue;
            }
            if (run.getWindowStart().isAfter(cursor.plus(tolerance))) {
                gaps.add(new IngestionGap(channelId, cursor, run.getWindowStart()));
            }
            cursor = run.getWindowEnd();
        }
        if (cursor.plus(tolerance).isBefore(end)) {
            gaps.add(new IngestionGap(channelId, cursor, end));
        }
        return gaps;
    }

    public static List<IngestionGap> findGaps(String channelId, Collection<IngestionRun> runs, Instant start, Instant end) {
        return findGaps(channelId, runs, start, end, DEFAULT_TOLERANCE);
    }
}
