package dev.devanks.energy.analyzer.model;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Set;

/**
 * Immutable snapshot of every analysis knob, taken once per run. Defaults here are the
 * lowest-precedence layer; application properties and then trigger payload overrides sit on top.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisSettings {

    @Builder.Default
    ZoneId timezone = ZoneId.of("America/New_York");
    /**
     * Expected sampling interval of the stored readings.
     */
    @Builder.Default
    Duration minWindowResolution = Duration.ofMinutes(15);
    @DecimalMin("0.0")
    @Builder.Default
    double unitRate = 0.12;
    @Builder.Default
    String currency = "USD";
    /**
     * Monthly demand charge per kW of peak; null when the tariff has none.
     */
    Double demandChargePerKw;
    @Builder.Default
    BusinessHoursCalendar businessHours = BusinessHoursCalendar.defaultCalendar();
    @Builder.Default
    int channelConcurrency = 4;

    // Baseline
    @Min(1)
    @Builder.Default
    int baselineWeeks = 4;
    @Builder.Default
    int minBucketSamples = 3;

    // Anomalies
    @DecimalMin("0.0")
    @Builder.Default
    double iqrMultiplier = 3.0;
    @Builder.Default
    int minEventSamples = 1;
    @Builder.Default
    double minEventExcessKwh = 0.0;

    // Spikes
    @DecimalMin("1.0")
    @Builder.Default
    double spikeMultiplier = 1.5;
    @DecimalMin("1.0")
    @Builder.Default
    double siteSpikeMultiplier = 2.0;
    @Builder.Default
    double submeterMinSpikeKw = 5.0;
    @Builder.Default
    double siteMinSpikeKw = 20.0;
    @Singular
    Set<String> siteChannelIds;

    // After hours
    @Builder.Default
    double afterHoursMinPowerKw = 0.1;
    @Builder.Default
    double afterHoursMinWeeklyExcessKwh = 10.0;
    @Builder.Default
    int afterHoursTopN = 10;

    // Sensor health
    @Builder.Default
    Duration staleAfter = Duration.ofHours(2);
    @Builder.Default
    int gapMinMissingSamples = 2;
    @Builder.Default
    int flatlineMinSamples = 24;
    @Builder.Default
    double flatlineTolerance = 0.0;
    @Builder.Default
    double completenessThresholdPct = 90.0;
    @Builder.Default
    double completenessCriticalPct = 50.0;

    // Severity tiers
    @Builder.Default
    double severityHighRatio = 1.0;
    @Builder.Default
    double severityMediumRatio = 0.25;
    @Builder.Default
    double severityHighKwh = 50.0;
    @Builder.Default
    double severityMediumKwh = 10.0;

    // Recommendations
    @Builder.Default
    int maxRecommendations = 10;
    @Builder.Default
    int maxRecommendationsPerType = 3;
    @Builder.Default
    double afterHoursHighPriorityKwh = 100.0;
    @Builder.Default
    double anomalyHighPriorityKwh = 50.0;

    /**
     * Site meters aggregate many loads, so they never get a tighter spike threshold than a sub-meter.
     */
    @AssertTrue(message = "spikeMultiplier must not exceed siteSpikeMultiplier")
    public boolean isSpikeMultipliersOrdered() {
        return spikeMultiplier <= siteSpikeMultiplier;
    }

    public double intervalHours() {
        return minWindowResolution.toMillis() / 3_600_000.0;
    }

    public boolean isSiteChannel(String channelId) {
        return siteChannelIds.contains(channelId);
    }

    public boolean isBusinessHours(Instant instant) {
        return businessHours.isBusinessHours(instant.atZone(timezone));
    }
}
