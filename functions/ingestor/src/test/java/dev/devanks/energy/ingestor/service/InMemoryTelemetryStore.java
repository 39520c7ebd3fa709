package dev.devanks.energy.ingestor.service;

import dev.devanks.energy.common.exception.PersistenceException;
import dev.devanks.energy.common.model.Channel;
import dev.devanks.energy.common.model.IngestionRun;
import dev.devanks.energy.common.model.Reading;
import dev.devanks.energy.common.service.TelemetryStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Map-backed store with the same insert-if-absent semantics as the Firestore one.
 */
class InMemoryTelemetryStore implements TelemetryStore {

    private final Map<String, Reading> readings = new ConcurrentHashMap<>();
    private final List<IngestionRun> runs = new CopyOnWriteArrayList<>();
    private final Map<String, Channel> channels = new ConcurrentHashMap<>();
    private volatile boolean failWrites;

    void failWrites() {
        this.failWrites = true;
    }

    List<Reading> readings() {
        return new ArrayList<>(readings.values());
    }

    List<IngestionRun> runs() {
        return List.copyOf(runs);
    }

    @Override
    public Mono<Boolean> upsertReading(Reading reading) {
        if (failWrites) {
            return Mono.error(new PersistenceException("Simulated write failure"));
        }
        var key = reading.getChannelId() + "_" + reading.getTimestamp().getEpochSecond();
        return Mono.just(readings.putIfAbsent(key, reading) == null);
    }

    @Override
    public Flux<Reading> queryReadings(String channelId, Instant start, Instant end) {
        return Flux.fromIterable(readings.values())
                .filter(r -> r.getChannelId().equals(channelId))
                .filter(r -> !r.getTimestamp().isBefore(start) && r.getTimestamp().isBefore(end))
                .sort(Comparator.comparing(Reading::getTimestamp));
    }

    @Override
    public Mono<Void> recordIngestionRun(IngestionRun run) {
        return Mono.fromRunnable(() -> runs.add(run));
    }

    @Override
    public Flux<IngestionRun> queryIngestionRuns(String channelId, Instant start, Instant end) {
        return Flux.fromIterable(runs)
                .filter(run -> run.getChannelId().equals(channelId))
                .filter(run -> run.getWindowStart().isBefore(end) && run.getWindowEnd().isAfter(start));
    }

    @Override
    public Mono<Channel> upsertChannel(Channel channel) {
        channels.put(channel.getChannelId(), channel);
        return Mono.just(channel);
    }

    @Override
    public Flux<Channel> findChannels(String siteId) {
        return Flux.fromIterable(channels.values()).filter(c -> siteId.equals(c.getSiteId()));
    }
}
