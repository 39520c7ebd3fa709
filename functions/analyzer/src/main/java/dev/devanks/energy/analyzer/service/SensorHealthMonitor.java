package dev.devanks.energy.analyzer.service;

import dev.devanks.energy.analyzer.model.AnalysisContext;
import dev.devanks.energy.analyzer.model.ChannelBaseline;
import dev.devanks.energy.analyzer.model.HealthIssue;
import dev.devanks.energy.analyzer.model.Severity;
import dev.devanks.energy.common.model.IngestionGap;
import dev.devanks.energy.common.model.IngestionRun;
import dev.devanks.energy.common.model.Reading;
import dev.devanks.energy.common.service.IngestionCoverage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Data-quality checks over the report period: gaps, staleness, flatlines and completeness.
 * Gaps not covered by a successful ingestion run are attributed to ingestion rather than the device.
 */
@Component
@Slf4j
public class SensorHealthMonitor {

    public List<HealthIssue> analyzeHealth(String channelId, List<Reading> reportReadings, List<IngestionRun> runs,
                                           ChannelBaseline baseline, AnalysisContext context) {
        var period = context.getReportPeriod();
        // Nothing can be expected after "now" when the period is still running.
        Instant observedEnd = context.getNow().isBefore(period.getEnd()) ? context.getNow() : period.getEnd();
        List<Instant> timestamps = reportReadings.stream()
                .map(Reading::getTimestamp)
                .filter(ts -> !ts.isBefore(period.getStart()) && ts.isBefore(observedEnd))
                .distinct()
                .sorted()
                .collect(Collectors.toList());

        List<HealthIssue> issues = new ArrayList<>();
        if (observedEnd.isAfter(period.getStart())) {
            var ingestionGaps = IngestionCoverage.findGaps(channelId, runs, period.getStart(), observedEnd);
            issues.addAll(findGaps(channelId, timestamps, ingestionGaps, observedEnd, baseline.getMeanPowerKw(), context));
            findStaleness(channelId, timestamps, observedEnd, context).ifPresent(issues::add);
            issues.addAll(findFlatlines(channelId, reportReadings, context));
            findLowCompleteness(channelId, timestamps.size(), observedEnd, context).ifPresent(issues::add);
        }

        issues.sort(Comparator.comparing(HealthIssue::getSeverity).thenComparing(HealthIssue::getStart));
        if (!issues.isEmpty()) {
            log.info("Channel {}: {} sensor health issue(s).", channelId, issues.size());
        }
        return issues;
    }

    private List<HealthIssue> findGaps(String channelId, List<Instant> timestamps, List<IngestionGap> ingestionGaps,
                                       Instant observedEnd, double typicalKw, AnalysisContext context) {
        var settings = context.getSettings();
        var interval = settings.getMinWindowResolution();
        var period = context.getReportPeriod();
        List<HealthIssue> gaps = new ArrayList<>();

        // Virtual samples one interval before the start and at the observed end catch leading and trailing gaps.
        Instant previous = period.getStart().minus(interval);
        List<Instant> points = new ArrayList<>(timestamps);
        points.add(observedEnd);
        for (Instant current : points) {
            long missing = Math.round(Duration.between(previous, current).toMillis() / (double) interval.toMillis()) - 1;
            if (missing >= settings.getGapMinMissingSamples()) {
                Instant gapStart = previous.plus(interval);
                double affectedKwh = missing * typicalKw * settings.intervalHours();
                var cause = ingestionGaps.stream().anyMatch(gap -> gap.overlaps(gapStart, current))
                        ? HealthIssue.Cause.INGESTION
                        : HealthIssue.Cause.DEVICE;
                gaps.add(HealthIssue.builder()
                        .channelId(channelId)
                        .type(HealthIssue.Type.GAP)
                        .severity(Severity.HIGH)
                        .start(gapStart)
                        .end(current)
                        .missingSamples((int) missing)
                        .cause(cause)
                        .affectedKwh(affectedKwh)
                        .estimatedCost(affectedKwh * settings.getUnitRate())
                        .description(String.format("%d missing readings between %s and %s (%s).",
                                missing, gapStart, current, cause == HealthIssue.Cause.INGESTION
                                        ? "never ingested" : "device reported nothing"))
                        .build());
            }
            previous = current;
        }
        return gaps;
    }

    private Optional<HealthIssue> findStaleness(String channelId, List<Instant> timestamps, Instant reference,
                                                AnalysisContext context) {
        var settings = context.getSettings();
        var period = context.getReportPeriod();
        Instant last = timestamps.isEmpty() ? null : timestamps.get(timestamps.size() - 1);
        Instant since = last != null ? last : period.getStart();
        if (!since.isBefore(reference) || Duration.between(since, reference).compareTo(settings.getStaleAfter()) <= 0) {
            return Optional.empty();
        }
        return Optional.of(HealthIssue.builder()
                .channelId(channelId)
                .type(HealthIssue.Type.STALE)
                .severity(Severity.HIGH)
                .start(since)
                .end(reference)
                .description(last == null
                        ? "No readings during the report period."
                        : String.format("No readings for %d h since %s.", Duration.between(last, reference).toHours(), last))
                .build());
    }

    private List<HealthIssue> findFlatlines(String channelId, List<Reading> reportReadings, AnalysisContext context) {
        var settings = context.getSettings();
        List<Reading> sorted = AnomalyDetector.sorted(reportReadings);
        List<HealthIssue> flatlines = new ArrayList<>();
        int runStart = 0;
        for (int i = 1; i <= sorted.size(); i++) {
            boolean continues = i < sorted.size()
                    && Math.abs(sorted.get(i).getPowerKw() - sorted.get(runStart).getPowerKw()) <= settings.getFlatlineTolerance();
            if (continues) {
                continue;
            }
            int length = i - runStart;
            double value = sorted.get(runStart).getPowerKw();
            if (length >= settings.getFlatlineMinSamples() && value != 0.0) {
                double suspectKwh = Math.abs(value) * length * settings.intervalHours();
                flatlines.add(HealthIssue.builder()
                        .channelId(channelId)
                        .type(HealthIssue.Type.FLATLINE)
                        .severity(Severity.MEDIUM)
                        .start(sorted.get(runStart).getTimestamp())
                        .end(sorted.get(i - 1).getTimestamp().plus(settings.getMinWindowResolution()))
                        .affectedKwh(suspectKwh)
                        .estimatedCost(suspectKwh * settings.getUnitRate())
                        .description(String.format("%d consecutive identical readings of %.3f kW.", length, value))
                        .build());
            }
            runStart = i;
        }
        return flatlines;
    }

    private Optional<HealthIssue> findLowCompleteness(String channelId, int received, Instant observedEnd,
                                                      AnalysisContext context) {
        var settings = context.getSettings();
        var period = context.getReportPeriod();
        long expected = Duration.between(period.getStart(), observedEnd).toMillis() / settings.getMinWindowResolution().toMillis();
        if (expected == 0) {
            return Optional.empty();
        }
        double pct = Math.min(100.0, 100.0 * received / expected);
        if (pct >= settings.getCompletenessThresholdPct()) {
            return Optional.empty();
        }
        return Optional.of(HealthIssue.builder()
                .channelId(channelId)
                .type(HealthIssue.Type.LOW_COMPLETENESS)
                .severity(pct < settings.getCompletenessCriticalPct() ? Severity.MEDIUM : Severity.LOW)
                .start(period.getStart())
                .end(observedEnd)
                .completenessPct(pct)
                .missingSamples((int) Math.max(0, expected - received))
                .description(String.format("%.1f%% of expected readings received (%d of %d).", pct, received, expected))
                .build());
    }
}
