package dev.devanks.energy.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Recommendation {

    public enum Type {
        AFTER_HOURS_WASTE,
        PORTFOLIO_AFTER_HOURS,
        ANOMALY_INVESTIGATION,
        SPIKE_REDUCTION,
        SENSOR_FIX,
        FLATLINE_CHECK
    }

    public enum Priority {
        HIGH,
        MEDIUM,
        LOW
    }

    public enum Confidence {
        HIGH,
        MEDIUM,
        LOW
    }

    Type type;
    Priority priority;
    Confidence confidence;
    /**
     * Null for site-wide recommendations.
     */
    String channelId;
    String title;
    String description;
    List<String> actions;
    Impact impact;

    @Value
    @Builder
    public static class Impact {
        double weeklyKwh;
        double weeklyCost;
        double annualKwh;
        double annualCost;

        @JsonIgnore
        public boolean isZero() {
            return weeklyKwh <= 0 && weeklyCost <= 0;
        }
    }
}
