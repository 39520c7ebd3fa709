package dev.devanks.energy.analyzer.service;

import dev.devanks.energy.analyzer.model.AnalysisContext;
import dev.devanks.energy.analyzer.model.AnomalyEvent;
import dev.devanks.energy.analyzer.model.ChannelBaseline;
import dev.devanks.energy.analyzer.model.Direction;
import dev.devanks.energy.analyzer.util.EventGrouper;
import dev.devanks.energy.analyzer.util.TimeBuckets;
import dev.devanks.energy.common.model.Reading;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Flags readings outside [median - k*IQR, median + k*IQR] of their hour-of-week bucket and merges
 * them into events. Buckets without enough baseline samples are skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnomalyDetector {

    private final SeverityClassifier severityClassifier;

    public List<AnomalyEvent> detectAnomalies(String channelId, List<Reading> reportReadings, ChannelBaseline baseline,
                                              AnalysisContext context) {
        var settings = context.getSettings();
        double k = settings.getIqrMultiplier();
        List<Deviation> deviations = new ArrayList<>();
        int skipped = 0;
        for (Reading reading : sorted(reportReadings)) {
            var profile = baseline.usableProfile(TimeBuckets.hourOfWeek(reading.getTimestamp(), settings.getTimezone()));
            if (profile.isEmpty()) {
                skipped++;
                continue;
            }
            double power = reading.getPowerKw();
            double upper = profile.get().upperBound(k);
            double lower = profile.get().lowerBound(k);
            if (power > upper) {
                deviations.add(new Deviation(reading.getTimestamp(), power, profile.get().getCenter(), Direction.ABOVE, power - upper));
            } else if (power < lower) {
                deviations.add(new Deviation(reading.getTimestamp(), power, profile.get().getCenter(), Direction.BELOW, lower - power));
            }
        }
        if (skipped > 0) {
            log.debug("Channel {}: {} report readings fell in buckets without a usable baseline.", channelId, skipped);
        }

        var interval = settings.getMinWindowResolution();
        return EventGrouper.group(deviations, Deviation::getTimestamp, interval,
                        (a, b) -> a.getDirection() == b.getDirection())
                .stream()
                .map(group -> toEvent(channelId, group, context))
                .filter(event -> event.getSampleCount() >= settings.getMinEventSamples())
                .filter(event -> event.getExcessKwh() >= settings.getMinEventExcessKwh())
                .collect(Collectors.toList());
    }

    private AnomalyEvent toEvent(String channelId, List<Deviation> group, AnalysisContext context) {
        var settings = context.getSettings();
        var first = group.get(0);
        var last = group.get(group.size() - 1);
        double excessKwh = group.stream().mapToDouble(Deviation::getDeviationKw).sum() * settings.intervalHours();
        var powers = group.stream().mapToDouble(Deviation::getPowerKw);
        double peak = first.getDirection() == Direction.ABOVE ? powers.max().orElse(0) : powers.min().orElse(0);
        return AnomalyEvent.builder()
                .channelId(channelId)
                .start(first.getTimestamp())
                .end(last.getTimestamp().plus(settings.getMinWindowResolution()))
                .direction(first.getDirection())
                .sampleCount(group.size())
                .expectedKw(group.stream().mapToDouble(Deviation::getExpectedKw).average().orElse(0))
                .peakKw(peak)
                .maxDeviationKw(group.stream().mapToDouble(Deviation::getDeviationKw).max().orElse(0))
                .excessKwh(excessKwh)
                .estimatedCost(first.getDirection() == Direction.ABOVE ? excessKwh * settings.getUnitRate() : 0.0)
                .severity(severityClassifier.classify(excessKwh, context.getSiteTypicalKw(), settings))
                .build();
    }

    static List<Reading> sorted(List<Reading> readings) {
        return readings.stream()
                .filter(Reading::hasPower)
                .sorted(Comparator.comparing(Reading::getTimestamp))
                .collect(Collectors.toList());
    }

    @Value
    private static class Deviation {
        Instant timestamp;
        double powerKw;
        double expectedKw;
        Direction direction;
        double deviationKw;
    }
}
