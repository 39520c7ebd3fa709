package dev.devanks.energy.analyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Robust power statistics (kW) for one channel and one time bucket.
 */
@Value
@Builder
public class BaselineProfile {
    String channelId;
    int bucket;
    /**
     * Median.
     */
    double center;
    /**
     * Interquartile range, q3 - q1.
     */
    double spread;
    double q1;
    double q3;
    double p5;
    double p95;
    int sampleCount;
    /**
     * False when the bucket has too few samples to threshold against.
     */
    boolean sufficient;

    public double lowerBound(double multiplier) {
        return center - multiplier * spread;
    }

    public double upperBound(double multiplier) {
        return center + multiplier * spread;
    }
}
