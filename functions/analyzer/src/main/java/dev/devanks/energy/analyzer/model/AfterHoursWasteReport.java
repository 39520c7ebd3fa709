package dev.devanks.energy.analyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Site-wide after-hours waste, with the worst channels ranked by weekly cost.
 */
@Value
@Builder
public class AfterHoursWasteReport {

    Summary summary;
    List<WasteSummary> topChannels;

    @Value
    @Builder
    public static class Summary {
        int channelsAnalyzed;
        int channelsWithExcess;
        double totalWeeklyExcessKwh;
        double totalWeeklyCost;
        double totalAnnualExcessKwh;
        double totalAnnualCost;
    }
}
