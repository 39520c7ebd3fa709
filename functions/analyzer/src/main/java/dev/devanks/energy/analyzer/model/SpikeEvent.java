package dev.devanks.energy.analyzer.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SpikeEvent {
    String channelId;
    Instant start;
    Instant end;
    int sampleCount;
    double peakKw;
    double thresholdKw;
    double baselineP95Kw;
    /**
     * Energy above the 95th percentile across the event.
     */
    double excessKwh;
    double estimatedCost;
    Severity severity;
}
