package dev.devanks.energy.common.service;

import dev.devanks.energy.common.model.Channel;
import dev.devanks.energy.common.model.IngestionRun;
import dev.devanks.energy.common.model.Reading;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Durable time-series storage keyed by (channel, timestamp), plus the ingestion audit log
 * and channel reference data. Failures surface as {@link dev.devanks.energy.common.exception.PersistenceException}.
 */
public interface TelemetryStore {

    /**
     * Stores the reading unless one already exists for the same channel and timestamp.
     *
     * @return {@code true} if a new row was written, {@code false} if the reading was already present.
     */
    Mono<Boolean> upsertReading(Reading reading);

    /**
     * Readings for a channel with timestamps in [start, end), ordered by timestamp.
     */
    Flux<Reading> queryReadings(String channelId, Instant start, Instant end);

    Mono<Void> recordIngestionRun(IngestionRun run);

    /**
     * Ingestion runs whose window overlaps [start, end).
     */
    Flux<IngestionRun> queryIngestionRuns(String channelId, Instant start, Instant end);

    Mono<Channel> upsertChannel(Channel channel);

    Flux<Channel> findChannels(String siteId);
}
