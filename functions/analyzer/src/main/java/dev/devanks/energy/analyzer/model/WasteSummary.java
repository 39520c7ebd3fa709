package dev.devanks.energy.analyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * After-hours consumption above a channel's idle load. Weekly figures are normalized by report length.
 */
@Value
@Builder
public class WasteSummary {
    String channelId;
    String channelName;
    boolean baselineAvailable;
    /**
     * Idle load; null when the baseline period had too few after-hours samples.
     */
    Double baselineKw;
    int afterHoursSamples;
    int excessSamples;
    double afterHoursAvgKw;
    double excessKwh;
    double weeklyExcessKwh;
    double weeklyCost;
    double annualExcessKwh;
    double annualCost;
    boolean significant;
}
