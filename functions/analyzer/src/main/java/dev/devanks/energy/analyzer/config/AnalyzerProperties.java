package dev.devanks.energy.analyzer.config;

import dev.devanks.energy.analyzer.model.AnalysisSettings;
import dev.devanks.energy.analyzer.model.BusinessHoursCalendar;
import dev.devanks.energy.analyzer.model.BusinessHoursCalendar.HourRange;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerProperties {

    /**
     * Site analyzed when the trigger names none.
     */
    @NotEmpty
    private String siteId;

    /**
     * Zone for business hours, hour-of-week buckets and week boundaries.
     */
    @NotEmpty
    private String timezone = "America/New_York";

    /**
     * Currency per kWh.
     */
    @DecimalMin("0.0")
    private double unitRate = 0.12;

    private String currency = "USD";

    /**
     * Monthly demand charge per kW; leave unset when the tariff has none.
     */
    private Double demandChargePerKw;

    /**
     * Sampling interval of stored readings.
     */
    @NotNull
    private Duration minWindowResolution = Duration.ofMinutes(15);

    /**
     * Anomaly sensitivity: width of the normal band in IQRs around the median.
     */
    @DecimalMin("0.0")
    private double iqrMultiplier = 3.0;

    /**
     * Spike sensitivity for sub-metered channels, as a multiple of the bucket's 95th percentile.
     */
    @DecimalMin("1.0")
    private double spikeMultiplier = 1.5;

    /**
     * Buckets with fewer samples are ignored when thresholding.
     */
    @Min(1)
    private int minBucketSamples = 3;

    /**
     * Opening hours per day as {@code HH:mm-HH:mm}, or {@code closed}. Missing days are closed.
     */
    private Map<DayOfWeek, String> businessHours = defaultBusinessHours();

    @Min(1)
    private int channelConcurrency = 4;

    @NotNull
    @Valid
    private Baseline baseline = new Baseline();

    @NotNull
    @Valid
    private Anomaly anomaly = new Anomaly();

    @NotNull
    @Valid
    private Spike spike = new Spike();

    @NotNull
    @Valid
    private AfterHours afterHours = new AfterHours();

    @NotNull
    @Valid
    private SensorHealth sensorHealth = new SensorHealth();

    @NotNull
    @Valid
    private Severity severity = new Severity();

    @NotNull
    @Valid
    private Recommendations recommendations = new Recommendations();

    @Data
    public static class Baseline {
        @Min(1)
        private int weeks = 4;
    }

    @Data
    public static class Anomaly {
        @Min(1)
        private int minEventSamples = 1;
        @DecimalMin("0.0")
        private double minEventExcessKwh = 0.0;
    }

    @Data
    public static class Spike {
        @DecimalMin("1.0")
        private double siteMultiplier = 2.0;
        private double submeterMinKw = 5.0;
        private double siteMinKw = 20.0;
        /**
         * Main meters and other site-level aggregates.
         */
        private Set<String> siteChannelIds = new HashSet<>();
    }

    @Data
    public static class AfterHours {
        private double minPowerKw = 0.1;
        private double minWeeklyExcessKwh = 10.0;
        @Min(1)
        private int topN = 10;
    }

    @Data
    public static class SensorHealth {
        @NotNull
        private Duration staleAfter = Duration.ofHours(2);
        @Min(1)
        private int gapMinMissingSamples = 2;
        @Min(2)
        private int flatlineMinSamples = 24;
        private double flatlineTolerance = 0.0;
        private double completenessThresholdPct = 90.0;
        private double completenessCriticalPct = 50.0;
    }

    @Data
    public static class Severity {
        private double highRatio = 1.0;
        private double mediumRatio = 0.25;
        private double highKwh = 50.0;
        private double mediumKwh = 10.0;
    }

    @Data
    public static class Recommendations {
        @Min(1)
        private int maxCount = 10;
        @Min(1)
        private int maxPerType = 3;
        private double afterHoursHighPriorityKwh = 100.0;
        private double anomalyHighPriorityKwh = 50.0;
    }

    @AssertTrue(message = "analyzer.spike-multiplier must not exceed analyzer.spike.site-multiplier")
    public boolean isSpikeMultipliersOrdered() {
        return spike == null || spikeMultiplier <= spike.getSiteMultiplier();
    }

    public AnalysisSettings toSettings() {
        return AnalysisSettings.builder()
                .timezone(ZoneId.of(timezone))
                .minWindowResolution(minWindowResolution)
                .unitRate(unitRate)
                .currency(currency)
                .demandChargePerKw(demandChargePerKw)
                .businessHours(toCalendar(businessHours))
                .channelConcurrency(channelConcurrency)
                .baselineWeeks(baseline.getWeeks())
                .minBucketSamples(minBucketSamples)
                .iqrMultiplier(iqrMultiplier)
                .minEventSamples(anomaly.getMinEventSamples())
                .minEventExcessKwh(anomaly.getMinEventExcessKwh())
                .spikeMultiplier(spikeMultiplier)
                .siteSpikeMultiplier(spike.getSiteMultiplier())
                .submeterMinSpikeKw(spike.getSubmeterMinKw())
                .siteMinSpikeKw(spike.getSiteMinKw())
                .siteChannelIds(spike.getSiteChannelIds())
                .afterHoursMinPowerKw(afterHours.getMinPowerKw())
                .afterHoursMinWeeklyExcessKwh(afterHours.getMinWeeklyExcessKwh())
                .afterHoursTopN(afterHours.getTopN())
                .staleAfter(sensorHealth.getStaleAfter())
                .gapMinMissingSamples(sensorHealth.getGapMinMissingSamples())
                .flatlineMinSamples(sensorHealth.getFlatlineMinSamples())
                .flatlineTolerance(sensorHealth.getFlatlineTolerance())
                .completenessThresholdPct(sensorHealth.getCompletenessThresholdPct())
                .completenessCriticalPct(sensorHealth.getCompletenessCriticalPct())
                .severityHighRatio(severity.getHighRatio())
                .severityMediumRatio(severity.getMediumRatio())
                .severityHighKwh(severity.getHighKwh())
                .severityMediumKwh(severity.getMediumKwh())
                .maxRecommendations(recommendations.getMaxCount())
                .maxRecommendationsPerType(recommendations.getMaxPerType())
                .afterHoursHighPriorityKwh(recommendations.getAfterHoursHighPriorityKwh())
                .anomalyHighPriorityKwh(recommendations.getAnomalyHighPriorityKwh())
                .build();
    }

    static BusinessHoursCalendar toCalendar(Map<DayOfWeek, String> businessHours) {
        var hours = new EnumMap<DayOfWeek, HourRange>(DayOfWeek.class);
        businessHours.forEach((day, text) -> {
            if (text != null && !text.isBlank() && !"closed".equalsIgnoreCase(text.trim())) {
                hours.put(day, HourRange.parse(text));
            }
        });
        return new BusinessHoursCalendar(hours);
    }

    private static Map<DayOfWeek, String> defaultBusinessHours() {
        var hours = new EnumMap<DayOfWeek, String>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            hours.put(day, day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY ? "closed" : "07:00-18:00");
        }
        return hours;
    }
}
