package dev.devanks.energy.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dev.devanks.energy.common.model.TimeWindow;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open [start, end) analysis period.
 */
@Value
public class ReportPeriod {
    Instant start;
    Instant end;

    public ReportPeriod(Instant start, Instant end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Period start must precede end: [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    @JsonIgnore
    public Duration getDuration() {
        return Duration.between(start, end);
    }

    /**
     * Length in weeks, fractional for partial weeks.
     */
    @JsonIgnore
    public double getWeeks() {
        return getDuration().toMillis() / (double) Duration.ofDays(7).toMillis();
    }

    public boolean overlaps(ReportPeriod other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public TimeWindow toWindow() {
        return new TimeWindow(start, end);
    }
}
