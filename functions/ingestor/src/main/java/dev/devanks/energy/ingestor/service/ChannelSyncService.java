package dev.devanks.energy.ingestor.service;

import dev.devanks.energy.common.service.TelemetryStore;
import dev.devanks.energy.ingestor.source.TelemetrySource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Copies channel metadata from the source into the store, creating or updating each channel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChannelSyncService {

    private final TelemetrySource telemetrySource;
    private final TelemetryStore telemetryStore;
    private final RetryPolicy retryPolicy;

    /**
     * @return the number of channels written.
     */
    public Mono<Long> syncChannels(String siteId) {
        log.info("Syncing channel metadata for site {}", siteId);
        return Mono.fromCallable(() -> telemetrySource.fetchChannels(siteId))
                .subscribeOn(Schedulers.boundedElastic())
                .retryWhen(retryPolicy.toRetry())
                .flatMapMany(Flux::fromIterable)
                .concatMap(channel -> telemetryStore.upsertChannel(channel)
                        .doOnSuccess(saved -> log.debug("Upserted channel {} ({})", channel.getChannelId(), channel.getName())))
                .count()
                .doOnSuccess(count -> log.info("Synced {} channel(s) for site {}", count, siteId))
                .doOnError(e -> log.error("Channel sync for site {} failed: {}", siteId, e.getMessage(), e));
    }
}
