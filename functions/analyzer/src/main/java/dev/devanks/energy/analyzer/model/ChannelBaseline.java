package dev.devanks.energy.analyzer.model;

import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Value
public class ChannelBaseline {

    String channelId;
    Map<Integer, BaselineProfile> profiles;
    double meanPowerKw;
    int sampleCount;

    public ChannelBaseline(String channelId, Map<Integer, BaselineProfile> profiles, double meanPowerKw, int sampleCount) {
        this.channelId = channelId;
        this.profiles = Collections.unmodifiableMap(new TreeMap<>(profiles));
        this.meanPowerKw = meanPowerKw;
        this.sampleCount = sampleCount;
    }

    public static ChannelBaseline empty(String channelId) {
        return new ChannelBaseline(channelId, Map.of(), 0.0, 0);
    }

    /**
     * The bucket's profile, only when it holds enough samples to be trusted.
     */
    public Optional<BaselineProfile> usableProfile(int bucket) {
        return Optional.ofNullable(profiles.get(bucket)).filter(BaselineProfile::isSufficient);
    }

    public long sufficientBuckets() {
        return profiles.values().stream().filter(BaselineProfile::isSufficient).count();
    }
}
