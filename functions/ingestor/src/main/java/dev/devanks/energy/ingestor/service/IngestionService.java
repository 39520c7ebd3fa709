package dev.devanks.energy.ingestor.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.common.exception.PersistenceException;
import dev.devanks.energy.common.model.Channel;
import dev.devanks.energy.common.model.IngestionGap;
import dev.devanks.energy.common.model.IngestionRun;
import dev.devanks.energy.common.model.Reading;
import dev.devanks.energy.common.model.TimeWindow;
import dev.devanks.energy.common.service.IngestionCoverage;
import dev.devanks.energy.common.service.TelemetryStore;
import dev.devanks.energy.ingestor.config.IngestorProperties;
import dev.devanks.energy.ingestor.model.IngestionResult;
import dev.devanks.energy.ingestor.source.TelemetrySource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Loads source readings into the store one window at a time.
 * <p>
 * Windows for a channel run strictly in sequence with a rate-limit pause between source calls;
 * different channels run concurrently. Each window produces exactly one {@link IngestionRun},
 * and a failed window never stops the remaining ones.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private final TelemetrySource telemetrySource;
    private final TelemetryStore telemetryStore;
    private final ReadingValidator readingValidator;
    private final RetryPolicy retryPolicy;
    private final IngestorProperties properties;
    private final Clock clock;

    /**
     * Ingests {@code [startDate, endDate)} for one channel, dates interpreted in the configured zone.
     */
    public Flux<IngestionRun> ingest(String channelId, LocalDate startDate, LocalDate endDate, boolean validate) {
        return ingestRange(channelId, startOf(startDate), startOf(endDate), validate);
    }

    public Flux<IngestionRun> ingestRange(String channelId, Instant start, Instant end, boolean validate) {
        var windows = TimeWindow.partition(start, end, properties.getPipeline().getWindowSize());
        if (windows.isEmpty()) {
            log.warn("Nothing to ingest for channel {}: range [{}, {}) is empty.", channelId, start, end);
            return Flux.empty();
        }
        log.info("Ingesting channel {} over [{}, {}) in {} window(s).", channelId, start, end, windows.size());
        return ingestWindows(channelId, windows, validate);
    }

    /**
     * Sub-intervals of [start, end) with no successful ingestion run.
     */
    public Flux<IngestionGap> findGaps(String channelId, Instant start, Instant end) {
        return telemetryStore.queryIngestionRuns(channelId, start, end)
                .collectList()
                .flatMapIterable(runs -> IngestionCoverage.findGaps(channelId, runs, start, end));
    }

    /**
     * Re-ingests only the parts of {@code [startDate, endDate)} that no successful run covers.
     */
    public Flux<IngestionRun> backfillGaps(String channelId, LocalDate startDate, LocalDate endDate, boolean validate) {
        var windowSize = properties.getPipeline().getWindowSize();
        return findGaps(channelId, startOf(startDate), startOf(endDate))
                .doOnNext(gap -> log.info("Channel {} has an ingestion gap [{}, {})", channelId, gap.getStart(), gap.getEnd()))
                .collectList()
                .flatMapMany(gaps -> {
                    if (gaps.isEmpty()) {
                        log.info("Channel {} is fully covered between {} and {}.", channelId, startDate, endDate);
                        return Flux.empty();
                    }
                    List<TimeWindow> windows = new ArrayList<>();
                    gaps.forEach(gap -> windows.addAll(TimeWindow.partition(gap.getStart(), gap.getEnd(), windowSize)));
                    return ingestWindows(channelId, windows, validate);
                });
    }

    public Mono<IngestionResult> ingestChannels(List<String> channelIds, LocalDate startDate, LocalDate endDate, boolean validate) {
        return forChannels(channelIds, channelId -> ingest(channelId, startDate, endDate, validate));
    }

    public Mono<IngestionResult> backfillChannels(List<String> channelIds, LocalDate startDate, LocalDate endDate, boolean validate) {
        return forChannels(channelIds, channelId -> backfillGaps(channelId, startDate, endDate, validate));
    }

    /**
     * Requested channels win; otherwise the configured list; otherwise every stored channel of the site.
     */
    public Mono<List<String>> resolveChannelIds(List<String> requested) {
        if (requested != null && !requested.isEmpty()) {
            return Mono.just(requested);
        }
        if (!properties.getChannelIds().isEmpty()) {
            return Mono.just(properties.getChannelIds());
        }
        return telemetryStore.findChannels(properties.getSiteId())
                .map(Channel::getChannelId)
                .collectList();
    }

    private Mono<IngestionResult> forChannels(List<String> channelIds, Function<String, Flux<IngestionRun>> perChannel) {
        long startedAt = clock.millis();
        return Flux.fromIterable(channelIds)
                .flatMap(perChannel, properties.getPipeline().getChannelConcurrency())
                .collectList()
                .map(runs -> IngestionResult.summarize(runs, channelIds.size(), clock.millis() - startedAt))
                .doOnNext(result -> log.info(result.getMessage()));
    }

    private Flux<IngestionRun> ingestWindows(String channelId, List<TimeWindow> windows, boolean validate) {
        var rateLimitDelay = properties.getPipeline().getRateLimitDelay();
        return Flux.fromIterable(windows)
                .index()
                .concatMap(indexed -> {
                    var run = ingestWindow(channelId, indexed.getT2(), validate);
                    if (indexed.getT1() == 0 || rateLimitDelay.isZero()) {
                        return run;
                    }
                    return run.delaySubscription(rateLimitDelay);
                });
    }

    /**
     * Fetches, validates and stores one window, then records its run. Never errors: failures become a
     * {@code FAILURE} run.
     */
    @VisibleForTesting
    Mono<IngestionRun> ingestWindow(String channelId, TimeWindow window, boolean validate) {
        var resolution = properties.getPipeline().getResolution();
        return Mono.fromCallable(() -> telemetrySource.fetchReadings(channelId, window.getStart(), window.getEnd(), resolution))
                .subscribeOn(Schedulers.boundedElastic())
                .retryWhen(retryPolicy.toRetry())
                .flatMap(readings -> storeWindow(channelId, window, readings, validate))
                .onErrorResume(e -> Mono.just(failedRun(channelId, window, 0, 0, 0, e)))
                .flatMap(this::recordRun);
    }

    @VisibleForTesting
    Mono<IngestionRun> storeWindow(String channelId, TimeWindow window, List<Reading> readings, boolean validate) {
        var now = clock.instant();
        List<Reading> accepted = new ArrayList<>(readings.size());
        int rejected = 0;
        for (Reading reading : readings) {
            var rejection = rejectionReason(reading, now, validate);
            if (rejection.isPresent()) {
                rejected++;
                log.warn("Rejected reading for channel {} at {}: {}", channelId, reading.getTimestamp(), rejection.get());
            } else {
                accepted.add(reading);
            }
        }

        int fetched = readings.size();
        int rejectedCount = rejected;
        var inserted = new AtomicInteger();
        return Flux.fromIterable(accepted)
                .concatMap(telemetryStore::upsertReading)
                .doOnNext(wasInserted -> {
                    if (Boolean.TRUE.equals(wasInserted)) {
                        inserted.incrementAndGet();
                    }
                })
                .then(Mono.fromCallable(() -> successfulRun(channelId, window, fetched, inserted.get(), rejectedCount)))
                .onErrorResume(PersistenceException.class,
                        e -> Mono.just(failedRun(channelId, window, fetched, inserted.get(), rejectedCount, e)));
    }

    // Without validation only readings that cannot be keyed are dropped.
    private Optional<String> rejectionReason(Reading reading, Instant now, boolean validate) {
        if (validate) {
            return readingValidator.validate(reading, now);
        }
        return reading.getTimestamp() == null ? Optional.of("Missing timestamp") : Optional.empty();
    }

    private Mono<IngestionRun> recordRun(IngestionRun run) {
        return telemetryStore.recordIngestionRun(run)
                .thenReturn(run)
                .onErrorResume(e -> {
                    log.error("Failed to record ingestion run for channel {} window [{}, {}): {}",
                            run.getChannelId(), run.getWindowStart(), run.getWindowEnd(), e.getMessage(), e);
                    return Mono.just(run);
                });
    }

    private IngestionRun successfulRun(String channelId, TimeWindow window, int fetched, int inserted, int rejected) {
        log.info("Channel {} window [{}, {}): fetched {}, inserted {}, rejected {}.",
                channelId, window.getStart(), window.getEnd(), fetched, inserted, rejected);
        return IngestionRun.builder()
                .channelId(channelId)
                .windowStart(window.getStart())
                .windowEnd(window.getEnd())
                .fetchedCount(fetched)
                .insertedCount(inserted)
                .rejectedCount(rejected)
                .status(IngestionRun.Status.SUCCESS)
                .recordedAt(clock.instant())
                .build();
    }

    private IngestionRun failedRun(String channelId, TimeWindow window, int fetched, int inserted, int rejected, Throwable e) {
        log.error("Channel {} window [{}, {}) failed: {}", channelId, window.getStart(), window.getEnd(), e.getMessage(), e);
        return IngestionRun.builder()
                .channelId(channelId)
                .windowStart(window.getStart())
                .windowEnd(window.getEnd())
                .fetchedCount(fetched)
                .insertedCount(inserted)
                .rejectedCount(rejected)
                .status(IngestionRun.Status.FAILURE)
                .error(e.getClass().getSimpleName() + ": " + e.getMessage())
                .recordedAt(clock.instant())
                .build();
    }

    private Instant startOf(LocalDate date) {
        return date.atStartOfDay(ZoneId.of(properties.getPipeline().getZone())).toInstant();
    }
}
