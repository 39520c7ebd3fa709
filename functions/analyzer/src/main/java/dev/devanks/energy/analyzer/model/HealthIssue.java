package dev.devanks.energy.analyzer.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class HealthIssue {

    public enum Type {
        GAP,
        STALE,
        FLATLINE,
        LOW_COMPLETENESS
    }

    /**
     * Where missing data was lost.
     */
    public enum Cause {
        /**
         * No successful ingestion run covered the period.
         */
        INGESTION,
        DEVICE
    }

    String channelId;
    Type type;
    Severity severity;
    Instant start;
    Instant end;
    String description;
    Integer missingSamples;
    Double completenessPct;
    Cause cause;
    /**
     * Energy that went unmonitored or is suspect, at the channel's typical load.
     */
    double affectedKwh;
    double estimatedCost;
}
