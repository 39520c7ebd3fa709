package dev.devanks.energy.analyzer.service;

import dev.devanks.energy.analyzer.model.AnalysisContext;
import dev.devanks.energy.analyzer.model.ChannelBaseline;
import dev.devanks.energy.analyzer.model.SpikeEvent;
import dev.devanks.energy.analyzer.util.EventGrouper;
import dev.devanks.energy.analyzer.util.TimeBuckets;
import dev.devanks.energy.common.model.Reading;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Short high-power excursions: power above max(p95 * multiplier, floor) of the hour-of-week bucket.
 * Site-level channels get a higher multiplier and floor than sub-meters.
 */
@Component
@RequiredArgsConstructor
public class SpikeDetector {

    private final SeverityClassifier severityClassifier;

    public List<SpikeEvent> detectSpikes(String channelId, List<Reading> reportReadings, ChannelBaseline baseline,
                                         AnalysisContext context) {
        var settings = context.getSettings();
        boolean site = settings.isSiteChannel(channelId);
        double multiplier = site ? settings.getSiteSpikeMultiplier() : settings.getSpikeMultiplier();
        double floorKw = site ? settings.getSiteMinSpikeKw() : settings.getSubmeterMinSpikeKw();

        List<Sample> samples = new ArrayList<>();
        for (Reading reading : AnomalyDetector.sorted(reportReadings)) {
            var profile = baseline.usableProfile(TimeBuckets.hourOfWeek(reading.getTimestamp(), settings.getTimezone()));
            if (profile.isEmpty()) {
                continue;
            }
            double p95 = profile.get().getP95();
            double threshold = Math.max(p95 * multiplier, floorKw);
            if (reading.getPowerKw() > threshold) {
                samples.add(new Sample(reading.getTimestamp(), reading.getPowerKw(), p95, threshold));
            }
        }

        return EventGrouper.group(samples, Sample::getTimestamp, settings.getMinWindowResolution(), (a, b) -> true)
                .stream()
                .map(group -> toEvent(channelId, group, context))
                .collect(Collectors.toList());
    }

    private SpikeEvent toEvent(String channelId, List<Sample> group, AnalysisContext context) {
        var settings = context.getSettings();
        double excessKwh = group.stream().mapToDouble(s -> s.getPowerKw() - s.getP95Kw()).sum() * settings.intervalHours();
        var peak = group.stream().max((a, b) -> Double.compare(a.getPowerKw(), b.getPowerKw())).orElseThrow();
        return SpikeEvent.builder()
                .channelId(channelId)
                .start(group.get(0).getTimestamp())
                .end(group.get(group.size() - 1).getTimestamp().plus(settings.getMinWindowResolution()))
                .sampleCount(group.size())
                .peakKw(peak.getPowerKw())
                .thresholdKw(peak.getThresholdKw())
                .baselineP95Kw(peak.getP95Kw())
                .excessKwh(excessKwh)
                .estimatedCost(excessKwh * settings.getUnitRate())
                .severity(severityClassifier.classify(excessKwh, context.getSiteTypicalKw(), settings))
                .build();
    }

    @Value
    private static class Sample {
        Instant timestamp;
        double powerKw;
        double p95Kw;
        double thresholdKw;
    }
}
