package dev.devanks.energy.ingestor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.devanks.energy.common.model.IngestionRun;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Totals over every window attempted by one trigger.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionResult {

    public enum Status {
        SUCCESS, PARTIAL_FAILURE, FAILURE
    }

    private static final int MAX_REPORTED_ERRORS = 5;

    private Status status;
    private String message;
    private Long durationMs;
    private int channels;
    private int windows;
    private int failedWindows;
    private long fetched;
    private long inserted;
    private long rejected;
    private String errorDetails; // Only populated when a window failed

    public static IngestionResult summarize(List<IngestionRun> runs, int channelCount, long durationMs) {
        var failed = runs.stream().filter(run -> !run.isSuccess()).toList();
        long fetched = runs.stream().mapToLong(IngestionRun::getFetchedCount).sum();
        long inserted = runs.stream().mapToLong(IngestionRun::getInsertedCount).sum();
        long rejected = runs.stream().mapToLong(IngestionRun::getRejectedCount).sum();

        Status status;
        if (failed.isEmpty()) {
            status = Status.SUCCESS;
        } else if (failed.size() == runs.size()) {
            status = Status.FAILURE;
        } else {
            status = Status.PARTIAL_FAILURE;
        }

        String errorDetails = failed.isEmpty() ? null : failed.stream()
                .limit(MAX_REPORTED_ERRORS)
                .map(run -> run.getChannelId() + " [" + run.getWindowStart() + "]: " + run.getError())
                .collect(Collectors.joining("; "));

        var message = String.format(
                "Ingestion %s in %d ms. Channels: %d, windows: %d (failed: %d), fetched: %d, inserted: %d, rejected: %d.",
                status, durationMs, channelCount, runs.size(), failed.size(), fetched, inserted, rejected);

        return IngestionResult.builder()
                .status(status)
                .message(message)
                .durationMs(durationMs)
                .channels(channelCount)
                .windows(runs.size())
                .failedWindows(failed.size())
                .fetched(fetched)
                .inserted(inserted)
                .rejected(rejected)
                .errorDetails(errorDetails)
                .build();
    }
}
