package dev.devanks.energy.analyzer.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A contiguous run of readings outside the channel's normal band. {@code end} is exclusive.
 */
@Value
@Builder
public class AnomalyEvent {
    String channelId;
    Instant start;
    Instant end;
    Direction direction;
    int sampleCount;
    double expectedKw;
    double peakKw;
    double maxDeviationKw;
    /**
     * Energy outside the band, always positive.
     */
    double excessKwh;
    /**
     * Zero for below-range events.
     */
    double estimatedCost;
    Severity severity;
}
