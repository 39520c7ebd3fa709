package dev.devanks.energy.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Audit record of one fetch attempt for a channel over a single window.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionRun {

    public enum Status {
        SUCCESS, FAILURE
    }

    String channelId;
    Instant windowStart;
    Instant windowEnd;
    int fetchedCount;
    int insertedCount;
    int rejectedCount;
    Status status;
    String error;
    Instant recordedAt;

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
