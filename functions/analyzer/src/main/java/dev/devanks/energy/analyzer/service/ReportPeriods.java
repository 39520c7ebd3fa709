package dev.devanks.energy.analyzer.service;

import dev.devanks.energy.analyzer.model.ReportPeriod;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar arithmetic for report and baseline periods. Week boundaries are local midnights, so a
 * week spanning a DST change is 167 or 169 hours long.
 */
public final class ReportPeriods {

    private ReportPeriods() {
    }

    /**
     * The most recent complete Monday-to-Sunday week before {@code now}.
     */
    public static ReportPeriod lastCompleteWeek(Instant now, ZoneId zone) {
        LocalDate thisMonday = LocalDate.ofInstant(now, zone).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return ofDates(thisMonday.minusWeeks(1), thisMonday, zone);
    }

    /**
     * {@code [startDate, endDate)} with both dates at local midnight.
     */
    public static ReportPeriod ofDates(LocalDate startDate, LocalDate endDate, ZoneId zone) {
        return new ReportPeriod(startDate.atStartOfDay(zone).toInstant(), endDate.atStartOfDay(zone).toInstant());
    }

    /**
     * The {@code weeks} weeks immediately preceding the report, ending exactly where it starts.
     */
    public static ReportPeriod baselineFor(ReportPeriod report, int weeks, ZoneId zone) {
        if (weeks < 1) {
            throw new IllegalArgumentException("Baseline must span at least one week, got " + weeks);
        }
        var start = report.getStart().atZone(zone).minusWeeks(weeks).toInstant();
        return new ReportPeriod(start, report.getStart());
    }

    /**
     * Rejects a baseline that overlaps the report or is not entirely before it.
     */
    public static void requireDisjoint(ReportPeriod report, ReportPeriod baseline) {
        if (baseline.overlaps(report) || baseline.getEnd().isAfter(report.getStart())) {
            throw new IllegalArgumentException("Baseline period [" + baseline.getStart() + ", " + baseline.getEnd()
                    + ") must end at or before the report start " + report.getStart());
        }
    }
}
