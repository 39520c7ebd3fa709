package dev.devanks.energy.analyzer.service;

import dev.devanks.energy.analyzer.model.AfterHoursWasteReport;
import dev.devanks.energy.analyzer.model.AnalysisContext;
import dev.devanks.energy.analyzer.model.AnalysisReport;
import dev.devanks.energy.analyzer.model.AnomalyEvent;
import dev.devanks.energy.analyzer.model.ChannelFindings;
import dev.devanks.energy.analyzer.model.Direction;
import dev.devanks.energy.analyzer.model.HealthIssue;
import dev.devanks.energy.analyzer.model.Recommendation;
import dev.devanks.energy.analyzer.model.ReportPeriod;
import dev.devanks.energy.analyzer.model.Severity;
import dev.devanks.energy.analyzer.model.SpikeEvent;
import dev.devanks.energy.analyzer.model.WasteSummary;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines per-channel findings into the report, ordering each section worst first.
 */
@Component
public class ReportAssembler {

    private static final Set<Recommendation.Type> SAVINGS_TYPES = EnumSet.of(
            Recommendation.Type.AFTER_HOURS_WASTE,
            Recommendation.Type.ANOMALY_INVESTIGATION,
            Recommendation.Type.SPIKE_REDUCTION);

    public AnalysisReport assemble(String siteId, ReportPeriod baselinePeriod, AnalysisContext context,
                                   List<ChannelFindings> findings, List<Recommendation> recommendations,
                                   List<String> skippedChannels) {
        var settings = context.getSettings();

        List<HealthIssue> health = findings.stream()
                .flatMap(channel -> channel.getHealthIssues().stream())
                .sorted(Comparator.comparing(HealthIssue::getSeverity)
                        .thenComparing(HealthIssue::getAffectedKwh, Comparator.reverseOrder()))
                .collect(Collectors.toList());
        List<AnomalyEvent> anomalies = findings.stream()
                .flatMap(channel -> channel.getAnomalies().stream())
                .sorted(Comparator.comparing(AnomalyEvent::getExcessKwh).reversed())
                .collect(Collectors.toList());
        List<SpikeEvent> spikes = findings.stream()
                .flatMap(channel -> channel.getSpikes().stream())
                .sorted(Comparator.comparing(SpikeEvent::getPeakKw).reversed())
                .collect(Collectors.toList());
        var waste = afterHoursWaste(findings, settings.getAfterHoursTopN());

        var summary = AnalysisReport.Summary.builder()
                .siteTypicalKw(context.getSiteTypicalKw())
                .anomalyCount(anomalies.size())
                .spikeCount(spikes.size())
                .healthIssueCount(health.size())
                .highSeverityIssueCount((int) health.stream().filter(issue -> issue.getSeverity() == Severity.HIGH).count())
                .channelsWithAfterHoursWaste(waste.getSummary().getChannelsWithExcess())
                .totalExcessKwh(anomalies.stream()
                        .filter(event -> event.getDirection() == Direction.ABOVE)
                        .mapToDouble(AnomalyEvent::getExcessKwh)
                        .sum())
                .potentialAnnualSavings(recommendations.stream()
                        .filter(r -> SAVINGS_TYPES.contains(r.getType()))
                        .mapToDouble(r -> r.getImpact().getAnnualCost())
                        .sum())
                .build();

        var metadata = AnalysisReport.Metadata.builder()
                .siteId(siteId)
                .generatedAt(context.getNow())
                .timezone(settings.getTimezone().getId())
                .energyUnit("kWh")
                .powerUnit("kW")
                .currency(settings.getCurrency())
                .unitRate(settings.getUnitRate())
                .resolutionSeconds(settings.getMinWindowResolution().getSeconds())
                .channelsAnalyzed(findings.size())
                .skippedChannels(skippedChannels)
                .build();

        return AnalysisReport.builder()
                .metadata(metadata)
                .period(context.getReportPeriod())
                .baselinePeriod(baselinePeriod)
                .summary(summary)
                .sensorHealth(health)
                .afterHoursWaste(waste)
                .anomalies(anomalies)
                .spikes(spikes)
                .recommendations(recommendations)
                .build();
    }

    static AfterHoursWasteReport afterHoursWaste(List<ChannelFindings> findings, int topN) {
        List<WasteSummary> all = findings.stream()
                .map(ChannelFindings::getWaste)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        List<WasteSummary> significant = all.stream()
                .filter(WasteSummary::isSignificant)
                .sorted(Comparator.comparing(WasteSummary::getWeeklyCost).reversed())
                .collect(Collectors.toList());
        var summary = AfterHoursWasteReport.Summary.builder()
                .channelsAnalyzed(all.size())
                .channelsWithExcess(significant.size())
                .totalWeeklyExcessKwh(significant.stream().mapToDouble(WasteSummary::getWeeklyExcessKwh).sum())
                .totalWeeklyCost(significant.stream().mapToDouble(WasteSummary::getWeeklyCost).sum())
                .totalAnnualExcessKwh(significant.stream().mapToDouble(WasteSummary::getAnnualExcessKwh).sum())
                .totalAnnualCost(significant.stream().mapToDouble(WasteSummary::getAnnualCost).sum())
                .build();
        return AfterHoursWasteReport.builder()
                .summary(summary)
                .topChannels(significant.stream().limit(topN).collect(Collectors.toList()))
                .build();
    }
}
