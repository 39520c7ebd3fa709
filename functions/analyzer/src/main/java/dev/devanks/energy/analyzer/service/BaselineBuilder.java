package dev.devanks.energy.analyzer.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.analyzer.model.AnalysisSettings;
import dev.devanks.energy.analyzer.model.BaselineProfile;
import dev.devanks.energy.analyzer.model.ChannelBaseline;
import dev.devanks.energy.analyzer.util.Statistics;
import dev.devanks.energy.analyzer.util.TimeBuckets;
import dev.devanks.energy.common.model.Reading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;

/**
 * Builds per-bucket power profiles from baseline-period readings only.
 */
@Component
@Slf4j
public class BaselineBuilder {

    /**
     * Hour-of-week profiles in the settings' zone.
     */
    public ChannelBaseline buildBaseline(String channelId, List<Reading> historical, AnalysisSettings settings) {
        var zone = settings.getTimezone();
        var baseline = build(channelId, historical,
                reading -> TimeBuckets.hourOfWeek(reading.getTimestamp(), zone), settings.getMinBucketSamples());
        log.debug("Channel {} baseline: {} samples, {} of {} buckets usable, mean {} kW.", channelId,
                baseline.getSampleCount(), baseline.sufficientBuckets(), baseline.getProfiles().size(),
                baseline.getMeanPowerKw());
        return baseline;
    }

    /**
     * Single profile of after-hours load above the idle floor. Its 5th percentile is the channel's idle load.
     */
    public Optional<BaselineProfile> buildAfterHoursProfile(String channelId, List<Reading> historical,
                                                            AnalysisSettings settings) {
        List<Reading> idle = historical.stream()
                .filter(Reading::hasPower)
                .filter(reading -> !settings.isBusinessHours(reading.getTimestamp()))
                .filter(reading -> reading.getPowerKw() > settings.getAfterHoursMinPowerKw())
                .collect(Collectors.toList());
        return build(channelId, idle, reading -> TimeBuckets.ALL, settings.getMinBucketSamples())
                .usableProfile(TimeBuckets.ALL);
    }

    @VisibleForTesting
    ChannelBaseline build(String channelId, List<Reading> readings, ToIntFunction<Reading> bucketOf, int minSamples) {
        Map<Integer, List<Double>> buckets = new TreeMap<>();
        List<Double> all = new ArrayList<>();
        for (Reading reading : readings) {
            if (!reading.hasPower()) {
                continue;
            }
            buckets.computeIfAbsent(bucketOf.applyAsInt(reading), key -> new ArrayList<>()).add(reading.getPowerKw());
            all.add(reading.getPowerKw());
        }
        Map<Integer, BaselineProfile> profiles = new HashMap<>();
        buckets.forEach((bucket, values) -> profiles.put(bucket, profile(channelId, bucket, values, minSamples)));
        double mean = all.isEmpty() ? 0.0 : Statistics.mean(Statistics.toArray(all));
        return new ChannelBaseline(channelId, profiles, mean, all.size());
    }

    private static BaselineProfile profile(String channelId, int bucket, List<Double> values, int minSamples) {
        double[] sorted = Statistics.toArray(values);
        Arrays.sort(sorted);
        double q1 = Statistics.percentile(sorted, 25.0);
        double q3 = Statistics.percentile(sorted, 75.0);
        return BaselineProfile.builder()
                .channelId(channelId)
                .bucket(bucket)
                .center(Statistics.median(sorted))
                .spread(q3 - q1)
                .q1(q1)
                .q3(q3)
                .p5(Statistics.percentile(sorted, 5.0))
                .p95(Statistics.percentile(sorted, 95.0))
                .sampleCount(sorted.length)
                .sufficient(sorted.length >= minSamples)
                .build();
    }
}
