package dev.devanks.energy.common.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * A sub-interval [start, end) of a channel's history that no successful ingestion run covers.
 */
@Value
public class IngestionGap {

    String channelId;
    Instant start;
    Instant end;

    public Duration getDuration() {
        return Duration.between(start, end);
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && otherStart.isBefore(end);
    }
}
