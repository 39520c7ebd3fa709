package dev.devanks.energy.analyzer.service;

import dev.devanks.energy.analyzer.model.AnalysisSettings;
import dev.devanks.energy.analyzer.model.ChannelBaseline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static dev.devanks.energy.analyzer.service.TestData.reading;
import static dev.devanks.energy.analyzer.service.TestData.series;
import static dev.devanks.energy.analyzer.service.TestData.settings;
import static dev.devanks.energy.analyzer.service.TestData.weekContext;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SpikeDetector Unit Tests")
class SpikeDetectorTest {

    private static final Instant REPORT_MONDAY_10 = Instant.parse("2024-01-22T10:00:00Z");

    private final BaselineBuilder baselineBuilder = new BaselineBuilder();
    private final SpikeDetector detector = new SpikeDetector(new SeverityClassifier());

    /**
     * Flat 4 kW on Monday mornings, so p95 is 4 kW.
     */
    private ChannelBaseline flatBaseline(String channelId, AnalysisSettings settings) {
        var history = series(channelId, Instant.parse("2024-01-15T10:00:00Z"), 4, i -> 4.0);
        history.addAll(series(channelId, Instant.parse("2024-01-08T10:00:00Z"), 4, i -> 4.0));
        return baselineBuilder.buildBaseline(channelId, history, settings);
    }

    @Test
    @DisplayName("sub-meter: power above max(1.5 x p95, 5 kW) is a spike")
    void detectSpikes_submeter() {
        var settings = settings();

        var spikes = detector.detectSpikes("sub", List.of(reading("sub", REPORT_MONDAY_10, 8.0)),
                flatBaseline("sub", settings), weekContext(settings, 0.0));

        assertThat(spikes).hasSize(1);
        var spike = spikes.get(0);
        assertThat(spike.getThresholdKw()).isEqualTo(6.0);
        assertThat(spike.getBaselineP95Kw()).isEqualTo(4.0);
        assertThat(spike.getPeakKw()).isEqualTo(8.0);
        assertThat(spike.getExcessKwh()).isCloseTo(1.0, within(1e-9));
        assertThat(spike.getEstimatedCost()).isCloseTo(0.12, within(1e-9));
    }

    @Test
    @DisplayName("sub-meter: the 5 kW floor applies when 1.5 x p95 is lower")
    void detectSpikes_submeterFloor() {
        var settings = settings();
        var history = series("sub", Instant.parse("2024-01-15T10:00:00Z"), 4, i -> 2.0);
        var baseline = baselineBuilder.buildBaseline("sub", history, settings);

        assertThat(detector.detectSpikes("sub", List.of(reading("sub", REPORT_MONDAY_10, 4.9)), baseline,
                weekContext(settings, 0.0))).isEmpty();
        assertThat(detector.detectSpikes("sub", List.of(reading("sub", REPORT_MONDAY_10, 5.1)), baseline,
                weekContext(settings, 0.0))).hasSize(1);
    }

    @Test
    @DisplayName("site channel: higher multiplier and 20 kW floor")
    void detectSpikes_siteChannel() {
        var settings = settings().toBuilder().siteChannelId("main").build();
        var baseline = flatBaseline("main", settings);

        assertThat(detector.detectSpikes("main", List.of(reading("main", REPORT_MONDAY_10, 8.0)), baseline,
                weekContext(settings, 0.0))).isEmpty();

        var spikes = detector.detectSpikes("main", List.of(reading("main", REPORT_MONDAY_10, 25.0)), baseline,
                weekContext(settings, 0.0));
        assertThat(spikes).hasSize(1);
        assertThat(spikes.get(0).getThresholdKw()).isEqualTo(20.0);
    }

    @Test
    @DisplayName("a bucket with too few baseline samples never yields a spike")
    void detectSpikes_insufficientBucket() {
        var settings = settings().toBuilder().siteChannelId("main").build();
        for (String channelId : List.of("sub", "main")) {
            var history = List.of(
                    reading(channelId, Instant.parse("2024-01-08T10:00:00Z"), 4.0),
                    reading(channelId, Instant.parse("2024-01-15T10:00:00Z"), 4.0));
            var baseline = baselineBuilder.buildBaseline(channelId, history, settings);

            var spikes = detector.detectSpikes(channelId, List.of(reading(channelId, REPORT_MONDAY_10, 500.0)),
                    baseline, weekContext(settings, 0.0));

            assertThat(spikes).as("channel %s", channelId).isEmpty();
        }
    }

    @Test
    @DisplayName("consecutive spike samples form one event with the highest peak")
    void detectSpikes_groupsConsecutiveSamples() {
        var settings = settings();
        var report = series("sub", REPORT_MONDAY_10, 3, i -> new double[]{7.0, 12.0, 9.0}[i]);

        var spikes = detector.detectSpikes("sub", report, flatBaseline("sub", settings), weekContext(settings, 0.0));

        assertThat(spikes).hasSize(1);
        assertThat(spikes.get(0).getSampleCount()).isEqualTo(3);
        assertThat(spikes.get(0).getPeakKw()).isEqualTo(12.0);
        assertThat(spikes.get(0).getEnd()).isEqualTo(REPORT_MONDAY_10.plusSeconds(45 * 60));
    }
}
