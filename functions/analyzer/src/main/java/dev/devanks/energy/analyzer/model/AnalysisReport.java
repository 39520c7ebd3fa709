package dev.devanks.energy.analyzer.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * The weekly report. Energy in kWh, power in kW, money in {@link Metadata#getCurrency()}.
 */
@Value
@Builder
public class AnalysisReport {

    Metadata metadata;
    ReportPeriod period;
    ReportPeriod baselinePeriod;
    Summary summary;
    List<HealthIssue> sensorHealth;
    AfterHoursWasteReport afterHoursWaste;
    List<AnomalyEvent> anomalies;
    List<SpikeEvent> spikes;
    List<Recommendation> recommendations;

    @Value
    @Builder
    public static class Metadata {
        String siteId;
        Instant generatedAt;
        String timezone;
        String energyUnit;
        String powerUnit;
        String currency;
        double unitRate;
        long resolutionSeconds;
        int channelsAnalyzed;
        List<String> skippedChannels;
    }

    @Value
    @Builder
    public static class Summary {
        double siteTypicalKw;
        int anomalyCount;
        int spikeCount;
        int healthIssueCount;
        int highSeverityIssueCount;
        int channelsWithAfterHoursWaste;
        double totalExcessKwh;
        double potentialAnnualSavings;
    }
}
