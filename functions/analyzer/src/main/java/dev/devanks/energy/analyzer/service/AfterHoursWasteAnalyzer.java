package dev.devanks.energy.analyzer.service;

import dev.devanks.energy.analyzer.model.AnalysisContext;
import dev.devanks.energy.analyzer.model.BaselineProfile;
import dev.devanks.energy.analyzer.model.WasteSummary;
import dev.devanks.energy.common.model.Channel;
import dev.devanks.energy.common.model.Reading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.List;

/**
 * Energy drawn outside business hours above the channel's historical idle load.
 */
@Component
@Slf4j
public class AfterHoursWasteAnalyzer {

    static final int WEEKS_PER_YEAR = 52;

    public WasteSummary analyzeAfterHours(Channel channel, List<Reading> reportReadings,
                                          Optional<BaselineProfile> afterHoursProfile, AnalysisContext context) {
        var settings = context.getSettings();
        double intervalHours = settings.intervalHours();
        int afterHoursSamples = 0;
        int excessSamples = 0;
        double afterHoursKwSum = 0;
        double excessKwh = 0;
        Double baselineKw = afterHoursProfile.map(BaselineProfile::getP5).orElse(null);

        for (Reading reading : reportReadings) {
            if (!reading.hasPower() || settings.isBusinessHours(reading.getTimestamp())) {
                continue;
            }
            afterHoursSamples++;
            afterHoursKwSum += reading.getPowerKw();
            if (baselineKw != null && reading.getPowerKw() > baselineKw) {
                excessSamples++;
                excessKwh += (reading.getPowerKw() - baselineKw) * intervalHours;
            }
        }
        if (baselineKw == null) {
            log.debug("Channel {}: not enough after-hours baseline samples for an idle load.", channel.getChannelId());
        }

        double weeks = context.getReportPeriod().getWeeks();
        double weeklyExcess = weeks > 0 ? excessKwh / weeks : 0.0;
        double weeklyCost = weeklyExcess * settings.getUnitRate();
        return WasteSummary.builder()
                .channelId(channel.getChannelId())
                .channelName(displayName(channel))
                .baselineAvailable(baselineKw != null)
                .baselineKw(baselineKw)
                .afterHoursSamples(afterHoursSamples)
                .excessSamples(excessSamples)
                .afterHoursAvgKw(afterHoursSamples == 0 ? 0.0 : afterHoursKwSum / afterHoursSamples)
                .excessKwh(excessKwh)
                .weeklyExcessKwh(weeklyExcess)
                .weeklyCost(weeklyCost)
                .annualExcessKwh(weeklyExcess * WEEKS_PER_YEAR)
                .annualCost(weeklyCost * WEEKS_PER_YEAR)
                .significant(weeklyExcess >= settings.getAfterHoursMinWeeklyExcessKwh())
                .build();
    }

    static String displayName(Channel channel) {
        return channel.getName() == null || channel.getName().isBlank() ? channel.getChannelId() : channel.getName();
    }
}
