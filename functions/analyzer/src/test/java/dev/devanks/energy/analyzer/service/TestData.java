package dev.devanks.energy.analyzer.service;

import dev.devanks.energy.analyzer.model.AnalysisContext;
import dev.devanks.energy.analyzer.model.AnalysisSettings;
import dev.devanks.energy.analyzer.model.ReportPeriod;
import dev.devanks.energy.common.model.Channel;
import dev.devanks.energy.common.model.Reading;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/**
 * Shared fixtures. Everything runs in UTC so hour-of-week buckets line up with the literal instants.
 */
final class TestData {

    static final Duration STEP = Duration.ofMinutes(15);
    /**
     * Monday.
     */
    static final Instant REPORT_START = Instant.parse("2024-01-22T00:00:00Z");
    static final Instant REPORT_END = Instant.parse("2024-01-29T00:00:00Z");
    static final ReportPeriod REPORT_WEEK = new ReportPeriod(REPORT_START, REPORT_END);
    static final ReportPeriod BASELINE_WEEKS = new ReportPeriod(Instant.parse("2023-12-25T00:00:00Z"), REPORT_START);

    private TestData() {
    }

    static AnalysisSettings settings() {
        return AnalysisSettings.builder().timezone(ZoneOffset.UTC).build();
    }

    static AnalysisContext context(AnalysisSettings settings, ReportPeriod period, double siteTypicalKw, Instant now) {
        return new AnalysisContext(settings, period, siteTypicalKw, now);
    }

    static AnalysisContext weekContext(AnalysisSettings settings, double siteTypicalKw) {
        return context(settings, REPORT_WEEK, siteTypicalKw, REPORT_END.plus(Duration.ofDays(1)));
    }

    static Reading reading(String channelId, Instant timestamp, double powerKw) {
        return Reading.builder()
                .channelId(channelId)
                .timestamp(timestamp)
                .powerKw(powerKw)
                .energyKwh(powerKw * 0.25)
                .build();
    }

    static List<Reading> series(String channelId, Instant start, int count, IntToDoubleFunction powerAt) {
        List<Reading> readings = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            readings.add(reading(channelId, start.plus(STEP.multipliedBy(i)), powerAt.applyAsDouble(i)));
        }
        return readings;
    }

    static Channel channel(String channelId, String name) {
        return Channel.builder().channelId(channelId).name(name).siteId("site-1").build();
    }
}
