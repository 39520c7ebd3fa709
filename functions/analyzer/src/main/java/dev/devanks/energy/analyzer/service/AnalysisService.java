package dev.devanks.energy.analyzer.service;

import dev.devanks.energy.analyzer.model.AnalysisContext;
import dev.devanks.energy.analyzer.model.AnalysisReport;
import dev.devanks.energy.analyzer.model.AnalysisSettings;
import dev.devanks.energy.analyzer.model.BaselineProfile;
import dev.devanks.energy.analyzer.model.ChannelBaseline;
import dev.devanks.energy.analyzer.model.ChannelFindings;
import dev.devanks.energy.analyzer.model.ReportPeriod;
import dev.devanks.energy.common.model.Channel;
import dev.devanks.energy.common.model.IngestionRun;
import dev.devanks.energy.common.model.Reading;
import dev.devanks.energy.common.service.TelemetryStore;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs the weekly analysis for one site.
 * <p>
 * Phase one loads each channel's report and baseline data and builds its baselines, channels in
 * parallel. The site's typical load is then known, and phase two runs the detectors for each channel
 * concurrently. A channel whose data cannot be loaded is skipped and listed in the report metadata.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisService {

    private final TelemetryStore telemetryStore;
    private final BaselineBuilder baselineBuilder;
    private final AnomalyDetector anomalyDetector;
    private final SpikeDetector spikeDetector;
    private final SensorHealthMonitor sensorHealthMonitor;
    private final AfterHoursWasteAnalyzer afterHoursWasteAnalyzer;
    private final RecommendationEngine recommendationEngine;
    private final ReportAssembler reportAssembler;
    private final Clock clock;

    /**
     * Analyzes the last complete week against the configured number of preceding weeks.
     */
    public Mono<AnalysisReport> analyzeLastWeek(String siteId, AnalysisSettings settings) {
        var report = ReportPeriods.lastCompleteWeek(clock.instant(), settings.getTimezone());
        return analyze(siteId, report, ReportPeriods.baselineFor(report, settings.getBaselineWeeks(), settings.getTimezone()), settings);
    }

    public Mono<AnalysisReport> analyze(String siteId, ReportPeriod report, ReportPeriod baseline, AnalysisSettings settings) {
        try {
            ReportPeriods.requireDisjoint(report, baseline);
        } catch (IllegalArgumentException e) {
            return Mono.error(e);
        }
        log.info("Analyzing site {} for [{}, {}) against baseline [{}, {}).", siteId,
                report.getStart(), report.getEnd(), baseline.getStart(), baseline.getEnd());
        List<String> skipped = new CopyOnWriteArrayList<>();

        return telemetryStore.findChannels(siteId)
                .flatMap(channel -> loadChannel(channel, report, baseline, settings)
                        .onErrorResume(e -> {
                            log.error("Skipping channel {}: could not load its data: {}", channel.getChannelId(), e.getMessage(), e);
                            skipped.add(channel.getChannelId());
                            return Mono.empty();
                        }), settings.getChannelConcurrency())
                .collectList()
                .flatMap(channels -> {
                    if (channels.isEmpty()) {
                        log.warn("Site {} has no analyzable channels.", siteId);
                    }
                    double siteTypicalKw = channels.stream().mapToDouble(data -> data.getBaseline().getMeanPowerKw()).sum();
                    var context = new AnalysisContext(settings, report, siteTypicalKw, clock.instant());
                    return Flux.fromIterable(channels)
                            .flatMap(data -> analyzeChannel(data, context), settings.getChannelConcurrency())
                            .collectList()
                            .map(findings -> reportAssembler.assemble(siteId, baseline, context, findings,
                                    recommendationEngine.generateRecommendations(findings, context),
                                    List.copyOf(skipped)));
                })
                .doOnNext(result -> log.info("Site {} analysis done: {} anomalies, {} spikes, {} health issues, {} recommendations.",
                        siteId, result.getSummary().getAnomalyCount(), result.getSummary().getSpikeCount(),
                        result.getSummary().getHealthIssueCount(), result.getRecommendations().size()));
    }

    private Mono<ChannelData> loadChannel(Channel channel, ReportPeriod report, ReportPeriod baseline, AnalysisSettings settings) {
        var channelId = channel.getChannelId();
        return Mono.zip(
                        telemetryStore.queryReadings(channelId, report.getStart(), report.getEnd()).collectList(),
                        telemetryStore.queryReadings(channelId, baseline.getStart(), baseline.getEnd()).collectList(),
                        telemetryStore.queryIngestionRuns(channelId, report.getStart(), report.getEnd()).collectList())
                .publishOn(Schedulers.parallel())
                .map(data -> new ChannelData(channel, data.getT1(), data.getT3(),
                        baselineBuilder.buildBaseline(channelId, data.getT2(), settings),
                        baselineBuilder.buildAfterHoursProfile(channelId, data.getT2(), settings)));
    }

    private Mono<ChannelFindings> analyzeChannel(ChannelData data, AnalysisContext context) {
        var channelId = data.getChannel().getChannelId();
        return Mono.zip(
                        Mono.fromCallable(() -> anomalyDetector.detectAnomalies(channelId, data.getReadings(), data.getBaseline(), context))
                                .subscribeOn(Schedulers.parallel()),
                        Mono.fromCallable(() -> spikeDetector.detectSpikes(channelId, data.getReadings(), data.getBaseline(), context))
                                .subscribeOn(Schedulers.parallel()),
                        Mono.fromCallable(() -> sensorHealthMonitor.analyzeHealth(channelId, data.getReadings(), data.getRuns(),
                                        data.getBaseline(), context))
                                .subscribeOn(Schedulers.parallel()),
                        Mono.fromCallable(() -> afterHoursWasteAnalyzer.analyzeAfterHours(data.getChannel(), data.getReadings(),
                                        data.getAfterHoursProfile(), context))
                                .subscribeOn(Schedulers.parallel()))
                .map(results -> ChannelFindings.builder()
                        .channel(data.getChannel())
                        .anomalies(results.getT1())
                        .spikes(results.getT2())
                        .healthIssues(results.getT3())
                        .waste(results.getT4())
                        .build());
    }

    @Value
    private static class ChannelData {
        Channel channel;
        List<Reading> readings;
        List<IngestionRun> runs;
        ChannelBaseline baseline;
        Optional<BaselineProfile> afterHoursProfile;
    }
}
