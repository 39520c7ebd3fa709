package dev.devanks.energy.analyzer.service;

import dev.devanks.energy.analyzer.model.AnalysisSettings;
import dev.devanks.energy.analyzer.model.ChannelBaseline;
import dev.devanks.energy.analyzer.model.Direction;
import dev.devanks.energy.analyzer.model.Severity;
import dev.devanks.energy.common.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static dev.devanks.energy.analyzer.service.TestData.reading;
import static dev.devanks.energy.analyzer.service.TestData.series;
import static dev.devanks.energy.analyzer.service.TestData.settings;
import static dev.devanks.energy.analyzer.service.TestData.weekContext;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("AnomalyDetector Unit Tests")
class AnomalyDetectorTest {

    private static final Instant REPORT_MONDAY_10 = Instant.parse("2024-01-22T10:00:00Z");

    private final BaselineBuilder baselineBuilder = new BaselineBuilder();
    private final AnomalyDetector detector = new AnomalyDetector(new SeverityClassifier());

    /**
     * Monday 10:00-10:45 on three baseline weeks, at 4, 5 and 6 kW.
     */
    private ChannelBaseline mondayMorningBaseline(AnalysisSettings settings) {
        List<Reading> history = new ArrayList<>();
        history.addAll(series("c1", Instant.parse("2024-01-01T10:00:00Z"), 4, i -> 4.0));
        history.addAll(series("c1", Instant.parse("2024-01-08T10:00:00Z"), 4, i -> 5.0));
        history.addAll(series("c1", Instant.parse("2024-01-15T10:00:00Z"), 4, i -> 6.0));
        return baselineBuilder.buildBaseline("c1", history, settings);
    }

    @Test
    @DisplayName("a reading above median + k*IQR is an above-range event")
    void detectAnomalies_singleReadingAboveRange() {
        var settings = settings();
        var history = List.of(
                reading("c1", Instant.parse("2024-01-01T10:00:00Z"), 4.0),
                reading("c1", Instant.parse("2024-01-08T10:00:00Z"), 5.0),
                reading("c1", Instant.parse("2024-01-15T10:00:00Z"), 6.0));
        var baseline = baselineBuilder.buildBaseline("c1", history, settings);

        var events = detector.detectAnomalies("c1", List.of(reading("c1", REPORT_MONDAY_10, 9.0)), baseline,
                weekContext(settings, 5.0));

        assertThat(events).hasSize(1);
        var event = events.get(0);
        assertThat(event.getDirection()).isEqualTo(Direction.ABOVE);
        assertThat(event.getStart()).isEqualTo(REPORT_MONDAY_10);
        assertThat(event.getEnd()).isEqualTo(REPORT_MONDAY_10.plusSeconds(900));
        assertThat(event.getExpectedKw()).isEqualTo(5.0);
        assertThat(event.getPeakKw()).isEqualTo(9.0);
        // Upper bound 5 + 3 * 1 = 8, so 1 kW over for a quarter hour.
        assertThat(event.getExcessKwh()).isCloseTo(0.25, within(1e-9));
        assertThat(event.getEstimatedCost()).isCloseTo(0.03, within(1e-9));
        assertThat(event.getSeverity()).isEqualTo(Severity.LOW);
    }

    @Test
    @DisplayName("a reading inside the band is not flagged")
    void detectAnomalies_normalReading() {
        var settings = settings();
        var events = detector.detectAnomalies("c1", List.of(reading("c1", REPORT_MONDAY_10, 5.0)),
                mondayMorningBaseline(settings), weekContext(settings, 5.0));

        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("adjacent samples merge and a change of direction starts a new event")
    void detectAnomalies_groupsByAdjacencyAndDirection() {
        // 12 samples of 4/5/6 -> median 5, IQR 2; with k = 1 the band is [3, 7].
        var settings = settings().toBuilder().iqrMultiplier(1.0).build();
        var report = series("c1", REPORT_MONDAY_10, 4, i -> new double[]{9.0, 9.0, 1.0, 5.0}[i]);

        var events = detector.detectAnomalies("c1", report, mondayMorningBaseline(settings), weekContext(settings, 5.0));

        assertThat(events).hasSize(2);
        assertThat(events.get(0).getDirection()).isEqualTo(Direction.ABOVE);
        assertThat(events.get(0).getSampleCount()).isEqualTo(2);
        assertThat(events.get(0).getExcessKwh()).isCloseTo(1.0, within(1e-9));
        assertThat(events.get(1).getDirection()).isEqualTo(Direction.BELOW);
        assertThat(events.get(1).getExcessKwh()).isCloseTo(0.5, within(1e-9));
        assertThat(events.get(1).getEstimatedCost()).isZero();
    }

    @Test
    @DisplayName("flagged samples separated by more than one interval are separate events")
    void detectAnomalies_splitsOnGap() {
        var settings = settings().toBuilder().iqrMultiplier(1.0).build();
        var report = series("c1", REPORT_MONDAY_10, 4, i -> i == 0 || i == 3 ? 9.0 : 5.0);

        var events = detector.detectAnomalies("c1", report, mondayMorningBaseline(settings), weekContext(settings, 5.0));

        assertThat(events).hasSize(2).allMatch(event -> event.getSampleCount() == 1);
    }

    @Test
    @DisplayName("buckets with too few baseline samples never produce events")
    void detectAnomalies_insufficientBucket() {
        var settings = settings();
        var history = List.of(
                reading("c1", Instant.parse("2024-01-01T10:00:00Z"), 4.0),
                reading("c1", Instant.parse("2024-01-08T10:00:00Z"), 5.0));
        var baseline = baselineBuilder.buildBaseline("c1", history, settings);

        var events = detector.detectAnomalies("c1", List.of(reading("c1", REPORT_MONDAY_10, 100.0)), baseline,
                weekContext(settings, 5.0));

        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("events below the minimum excess are dropped")
    void detectAnomalies_minimumExcessFilter() {
        var settings = settings().toBuilder().minEventExcessKwh(1.0).build();
        var baseline = mondayMorningBaseline(settings);

        var events = detector.detectAnomalies("c1", List.of(reading("c1", REPORT_MONDAY_10, 12.0)), baseline,
                weekContext(settings, 5.0));

        // Band [5 - 3 * 2, 5 + 3 * 2] = [-1, 11]; 1 kW over for 15 minutes is 0.25 kWh.
        assertThat(events).isEmpty();
    }
}
