package dev.devanks.energy.analyzer.service;

import dev.devanks.energy.analyzer.model.AnalysisContext;
import dev.devanks.energy.analyzer.model.AnalysisSettings;
import dev.devanks.energy.analyzer.model.AnomalyEvent;
import dev.devanks.energy.analyzer.model.ChannelFindings;
import dev.devanks.energy.analyzer.model.Direction;
import dev.devanks.energy.analyzer.model.HealthIssue;
import dev.devanks.energy.analyzer.model.Recommendation;
import dev.devanks.energy.analyzer.model.Recommendation.Confidence;
import dev.devanks.energy.analyzer.model.Recommendation.Impact;
import dev.devanks.energy.analyzer.model.Recommendation.Priority;
import dev.devanks.energy.analyzer.model.Recommendation.Type;
import dev.devanks.energy.analyzer.model.Severity;
import dev.devanks.energy.analyzer.model.SpikeEvent;
import dev.devanks.energy.analyzer.model.WasteSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns findings into a short, ranked action list. Every recommendation carries a weekly energy or cost
 * impact; zero-impact ones are dropped, duplicates per (type, channel) collapse to the largest.
 */
@Component
@Slf4j
public class RecommendationEngine {

    private static final Comparator<Recommendation> RANKING = Comparator
            .comparing(Recommendation::getPriority)
            .thenComparing(r -> r.getImpact().getAnnualCost(), Comparator.reverseOrder());

    public List<Recommendation> generateRecommendations(List<ChannelFindings> findings, AnalysisContext context) {
        var settings = context.getSettings();
        double weeks = Math.max(context.getReportPeriod().getWeeks(), 1e-9);

        List<Recommendation> candidates = new ArrayList<>();
        candidates.addAll(topPerType(afterHoursWaste(findings, settings), settings));
        portfolioAfterHours(findings, settings).ifPresent(candidates::add);
        candidates.addAll(topPerType(anomalyInvestigations(findings, weeks, settings), settings));
        candidates.addAll(topPerType(spikeReductions(findings, weeks, settings), settings));
        candidates.addAll(topPerType(sensorFixes(findings, weeks, settings), settings));
        candidates.addAll(topPerType(flatlineChecks(findings, weeks, settings), settings));

        Map<String, Recommendation> unique = new LinkedHashMap<>();
        for (Recommendation candidate : candidates) {
            if (candidate.getImpact().isZero()) {
                continue;
            }
            unique.merge(candidate.getType() + "|" + Objects.toString(candidate.getChannelId(), ""), candidate,
                    (a, b) -> a.getImpact().getAnnualCost() >= b.getImpact().getAnnualCost() ? a : b);
        }
        List<Recommendation> ranked = unique.values().stream()
                .sorted(RANKING)
                .limit(settings.getMaxRecommendations())
                .collect(Collectors.toList());
        log.info("Generated {} recommendation(s) from {} candidate(s).", ranked.size(), candidates.size());
        return ranked;
    }

    private List<Recommendation> afterHoursWaste(List<ChannelFindings> findings, AnalysisSettings settings) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (ChannelFindings channel : findings) {
            WasteSummary waste = channel.getWaste();
            if (waste == null || !waste.isSignificant()) {
                continue;
            }
            recommendations.add(Recommendation.builder()
                    .type(Type.AFTER_HOURS_WASTE)
                    .priority(waste.getWeeklyExcessKwh() > settings.getAfterHoursHighPriorityKwh() ? Priority.HIGH : Priority.MEDIUM)
                    .confidence(waste.getExcessSamples() > 100 ? Confidence.HIGH : Confidence.MEDIUM)
                    .channelId(waste.getChannelId())
                    .title("Reduce after-hours load on " + waste.getChannelName())
                    .description(String.format("%s averages %.2f kW outside business hours against an idle load of %.2f kW, "
                                    + "wasting about %.1f kWh per week.", waste.getChannelName(), waste.getAfterHoursAvgKw(),
                            waste.getBaselineKw(), waste.getWeeklyExcessKwh()))
                    .actions(List.of("Check schedules and timers for equipment on this circuit.",
                            "Confirm what must legitimately run overnight and at weekends."))
                    .impact(impact(waste.getWeeklyExcessKwh(), 0.0, settings))
                    .build());
        }
        return recommendations;
    }

    private Optional<Recommendation> portfolioAfterHours(List<ChannelFindings> findings, AnalysisSettings settings) {
        List<WasteSummary> significant = findings.stream()
                .map(ChannelFindings::getWaste)
                .filter(waste -> waste != null && waste.isSignificant())
                .collect(Collectors.toList());
        if (significant.size() < 2) {
            return Optional.empty();
        }
        double weeklyKwh = significant.stream().mapToDouble(WasteSummary::getWeeklyExcessKwh).sum();
        return Optional.of(Recommendation.builder()
                .type(Type.PORTFOLIO_AFTER_HOURS)
                .priority(Priority.HIGH)
                .confidence(Confidence.MEDIUM)
                .title("Introduce a site-wide after-hours shutdown routine")
                .description(String.format("%d circuits run above their idle load outside business hours, "
                        + "together about %.1f kWh per week.", significant.size(), weeklyKwh))
                .actions(List.of("Agree a closing checklist covering every flagged circuit.",
                        "Use building controls to enforce setbacks outside business hours."))
                .impact(impact(weeklyKwh, 0.0, settings))
                .build());
    }

    private List<Recommendation> anomalyInvestigations(List<ChannelFindings> findings, double weeks, AnalysisSettings settings) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (ChannelFindings channel : findings) {
            List<AnomalyEvent> above = channel.getAnomalies().stream()
                    .filter(event -> event.getDirection() == Direction.ABOVE)
                    .collect(Collectors.toList());
            if (above.isEmpty()) {
                continue;
            }
            double weeklyKwh = above.stream().mapToDouble(AnomalyEvent::getExcessKwh).sum() / weeks;
            String name = AfterHoursWasteAnalyzer.displayName(channel.getChannel());
            recommendations.add(Recommendation.builder()
                    .type(Type.ANOMALY_INVESTIGATION)
                    .priority(weeklyKwh > settings.getAnomalyHighPriorityKwh() ? Priority.HIGH : Priority.MEDIUM)
                    .confidence(above.size() >= 3 ? Confidence.HIGH : Confidence.MEDIUM)
                    .channelId(channel.getChannel().getChannelId())
                    .title("Investigate unusual consumption on " + name)
                    .description(String.format("%d period(s) ran above the normal range for their hour of week, "
                            + "about %.1f kWh per week more than expected.", above.size(), weeklyKwh))
                    .actions(List.of("Compare the flagged periods with occupancy and operating logs.",
                            "Look for equipment left in manual override."))
                    .impact(impact(weeklyKwh, 0.0, settings))
                    .build());
        }
        return recommendations;
    }

    private List<Recommendation> spikeReductions(List<ChannelFindings> findings, double weeks, AnalysisSettings settings) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (ChannelFindings channel : findings) {
            if (channel.getSpikes().isEmpty()) {
                continue;
            }
            double weeklyKwh = channel.getSpikes().stream().mapToDouble(SpikeEvent::getExcessKwh).sum() / weeks;
            double weeklyDemandCost = 0.0;
            if (settings.getDemandChargePerKw() != null) {
                double shavedKw = channel.getSpikes().stream()
                        .mapToDouble(spike -> spike.getPeakKw() - spike.getBaselineP95Kw())
                        .max()
                        .orElse(0.0);
                weeklyDemandCost = shavedKw * settings.getDemandChargePerKw() * 12 / AfterHoursWasteAnalyzer.WEEKS_PER_YEAR;
            }
            var peak = channel.getSpikes().stream().mapToDouble(SpikeEvent::getPeakKw).max().orElse(0.0);
            String name = AfterHoursWasteAnalyzer.displayName(channel.getChannel());
            recommendations.add(Recommendation.builder()
                    .type(Type.SPIKE_REDUCTION)
                    .priority(Priority.MEDIUM)
                    .confidence(Confidence.MEDIUM)
                    .channelId(channel.getChannel().getChannelId())
                    .title("Smooth demand peaks on " + name)
                    .description(String.format("%d spike(s) peaking at %.1f kW.", channel.getSpikes().size(), peak))
                    .actions(List.of("Stagger start-up of large loads.",
                            "Check for short-cycling equipment."))
                    .impact(impact(weeklyKwh, weeklyDemandCost, settings))
                    .build());
        }
        return recommendations;
    }

    private List<Recommendation> sensorFixes(List<ChannelFindings> findings, double weeks, AnalysisSettings settings) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (ChannelFindings channel : findings) {
            List<HealthIssue> serious = channel.getHealthIssues().stream()
                    .filter(issue -> issue.getSeverity() == Severity.HIGH)
                    .collect(Collectors.toList());
            if (serious.isEmpty()) {
                continue;
            }
            double weeklyKwh = serious.stream().mapToDouble(HealthIssue::getAffectedKwh).sum() / weeks;
            boolean ingestion = serious.stream().anyMatch(issue -> issue.getCause() == HealthIssue.Cause.INGESTION);
            String name = AfterHoursWasteAnalyzer.displayName(channel.getChannel());
            recommendations.add(Recommendation.builder()
                    .type(Type.SENSOR_FIX)
                    .priority(Priority.HIGH)
                    .confidence(Confidence.HIGH)
                    .channelId(channel.getChannel().getChannelId())
                    .title("Restore monitoring on " + name)
                    .description(String.format("%d data gap(s) or outage(s) left about %.1f kWh per week unmonitored.",
                            serious.size(), weeklyKwh))
                    .actions(ingestion
                            ? List.of("Backfill the uncovered windows from the telemetry source.")
                            : List.of("Check meter power, wiring and network connectivity."))
                    .impact(impact(weeklyKwh, 0.0, settings))
                    .build());
        }
        return recommendations;
    }

    private List<Recommendation> flatlineChecks(List<ChannelFindings> findings, double weeks, AnalysisSettings settings) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (ChannelFindings channel : findings) {
            double suspectKwh = channel.getHealthIssues().stream()
                    .filter(issue -> issue.getType() == HealthIssue.Type.FLATLINE)
                    .mapToDouble(HealthIssue::getAffectedKwh)
                    .sum();
            if (suspectKwh <= 0) {
                continue;
            }
            String name = AfterHoursWasteAnalyzer.displayName(channel.getChannel());
            recommendations.add(Recommendation.builder()
                    .type(Type.FLATLINE_CHECK)
                    .priority(Priority.LOW)
                    .confidence(Confidence.MEDIUM)
                    .channelId(channel.getChannel().getChannelId())
                    .title("Verify the meter on " + name)
                    .description("The meter repeated the same non-zero value for long stretches; readings may be stuck.")
                    .actions(List.of("Compare against a portable meter reading."))
                    .impact(impact(suspectKwh / weeks, 0.0, settings))
                    .build());
        }
        return recommendations;
    }

    private static List<Recommendation> topPerType(List<Recommendation> recommendations, AnalysisSettings settings) {
        return recommendations.stream()
                .filter(r -> !r.getImpact().isZero())
                .sorted(Comparator.comparing((Recommendation r) -> r.getImpact().getAnnualCost()).reversed())
                .limit(settings.getMaxRecommendationsPerType())
                .collect(Collectors.toList());
    }

    private static Impact impact(double weeklyKwh, double extraWeeklyCost, AnalysisSettings settings) {
        double weeklyCost = weeklyKwh * settings.getUnitRate() + extraWeeklyCost;
        return Impact.builder()
                .weeklyKwh(weeklyKwh)
                .weeklyCost(weeklyCost)
                .annualKwh(weeklyKwh * AfterHoursWasteAnalyzer.WEEKS_PER_YEAR)
                .annualCost(weeklyCost * AfterHoursWasteAnalyzer.WEEKS_PER_YEAR)
                .build();
    }
}
