package dev.devanks.energy.common.service;

import dev.devanks.energy.common.entity.ChannelEntity;
import dev.devanks.energy.common.entity.IngestionRunEntity;
import dev.devanks.energy.common.entity.ReadingEntity;
import dev.devanks.energy.common.exception.PersistenceException;
import dev.devanks.energy.common.model.Channel;
import dev.devanks.energy.common.model.IngestionRun;
import dev.devanks.energy.common.model.Reading;
import dev.devanks.energy.common.repository.ChannelRepository;
import dev.devanks.energy.common.repository.IngestionRunRepository;
import dev.devanks.energy.common.repository.ReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class FirestoreService implements TelemetryStore {

    private final ReadingRepository readingRepository;
    private final IngestionRunRepository ingestionRunRepository;
    private final ChannelRepository channelRepository;
    private final TransactionalOperator transactionalOperator;
    private final Clock clock;

    /**
     * Existence check and write share one transaction. When another writer stores the same document
     * first, the commit fails and the reading is not counted as inserted.
     */
    @Override
    public Mono<Boolean> upsertReading(Reading reading) {
        var entity = toEntity(reading);
        return readingRepository.existsById(entity.getId())
                .flatMap(exists -> {
                    if (Boolean.TRUE.equals(exists)) {
                        log.debug("Reading {} already stored, skipping.", entity.getId());
                        return Mono.just(false);
                    }
                    return readingRepository.save(entity).thenReturn(true);
                })
                .as(transactionalOperator::transactional)
                .onErrorMap(e -> !(e instanceof PersistenceException),
                        e -> new PersistenceException("Failed to upsert reading " + entity.getId() + ": " + e.getMessage(), e));
    }

    @Override
    public Flux<Reading> queryReadings(String channelId, Instant start, Instant end) {
        return readingRepository
                .findByChannelIdAndEpochSecondGreaterThanEqualAndEpochSecondLessThanOrderByEpochSecond(
                        channelId, start.getEpochSecond(), end.getEpochSecond())
                .map(this::toModel)
                .onErrorMap(e -> !(e instanceof PersistenceException),
                        e -> new PersistenceException("Failed to query readings for channel " + channelId + ": " + e.getMessage(), e));
    }

    @Override
    public Mono<Void> recordIngestionRun(IngestionRun run) {
        var entity = toEntity(run);
        return ingestionRunRepository.save(entity)
                .doOnSuccess(saved -> log.debug("Recorded ingestion run {}", entity.getId()))
                .then()
                .onErrorMap(e -> !(e instanceof PersistenceException),
                        e -> new PersistenceException("Failed to record ingestion run " + entity.getId() + ": " + e.getMessage(), e));
    }

    @Override
    public Flux<IngestionRun> queryIngestionRuns(String channelId, Instant start, Instant end) {
        return ingestionRunRepository.findByChannelIdAndWindowStartEpochLessThan(channelId, end.getEpochSecond())
                .filter(entity -> entity.getWindowEndEpoch() > start.getEpochSecond())
                .map(this::toModel)
                .onErrorMap(e -> !(e instanceof PersistenceException),
                        e -> new PersistenceException("Failed to query ingestion runs for channel " + channelId + ": " + e.getMessage(), e));
    }

    @Override
    public Mono<Channel> upsertChannel(Channel channel) {
        return channelRepository.save(toEntity(channel))
                .map(this::toModel)
                .onErrorMap(e -> !(e instanceof PersistenceException),
                        e -> new PersistenceException("Failed to save channel " + channel.getChannelId() + ": " + e.getMessage(), e));
    }

    @Override
    public Flux<Channel> findChannels(String siteId) {
        return channelRepository.findBySiteId(siteId)
                .map(this::toModel)
                .onErrorMap(e -> !(e instanceof PersistenceException),
                        e -> new PersistenceException("Failed to load channels for site " + siteId + ": " + e.getMessage(), e));
    }

    private ReadingEntity toEntity(Reading reading) {
        return ReadingEntity.builder()
                .id(ReadingEntity.documentId(reading.getChannelId(), reading.getTimestamp()))
                .channelId(reading.getChannelId())
                .readingTimestamp(reading.getTimestamp())
                .epochSecond(reading.getTimestamp().getEpochSecond())
                .energyKwh(reading.getEnergyKwh())
                .powerKw(reading.getPowerKw())
                .voltageV(reading.getVoltageV())
                .currentA(reading.getCurrentA())
                .powerFactor(reading.getPowerFactor())
                .temperatureC(reading.getTemperatureC())
                .ingestedTimestamp(clock.instant())
                .build();
    }

    private Reading toModel(ReadingEntity entity) {
        var timestamp = entity.getReadingTimestamp() != null
                ? entity.getReadingTimestamp()
                : Instant.ofEpochSecond(entity.getEpochSecond());
        return Reading.builder()
                .channelId(entity.getChannelId())
                .timestamp(timestamp)
                .energyKwh(entity.getEnergyKwh())
                .powerKw(entity.getPowerKw())
                .voltageV(entity.getVoltageV())
                .currentA(entity.getCurrentA())
                .powerFactor(entity.getPowerFactor())
                .temperatureC(entity.getTemperatureC())
                .build();
    }

    private IngestionRunEntity toEntity(IngestionRun run) {
        var recordedAt = run.getRecordedAt() != null ? run.getRecordedAt() : clock.instant();
        // Append-only: every attempt gets its own document.
        var id = run.getChannelId() + "_" + run.getWindowStart().getEpochSecond() + "_" + recordedAt.toEpochMilli();
        return IngestionRunEntity.builder()
                .id(id)
                .channelId(run.getChannelId())
                .windowStart(run.getWindowStart())
                .windowEnd(run.getWindowEnd())
                .windowStartEpoch(run.getWindowStart().getEpochSecond())
                .windowEndEpoch(run.getWindowEnd().getEpochSecond())
                .fetchedCount(run.getFetchedCount())
                .insertedCount(run.getInsertedCount())
                .rejectedCount(run.getRejectedCount())
                .status(run.getStatus().name())
                .error(run.getError())
                .recordedAt(recordedAt)
                .build();
    }

    private IngestionRun toModel(IngestionRunEntity entity) {
        return IngestionRun.builder()
                .channelId(entity.getChannelId())
                .windowStart(Instant.ofEpochSecond(entity.getWindowStartEpoch()))
                .windowEnd(Instant.ofEpochSecond(entity.getWindowEndEpoch()))
                .fetchedCount(entity.getFetchedCount())
                .insertedCount(entity.getInsertedCount())
                .rejectedCount(entity.getRejectedCount())
                .status(IngestionRun.Status.valueOf(entity.getStatus()))
                .error(entity.getError())
                .recordedAt(entity.getRecordedAt())
                .build();
    }

    private ChannelEntity toEntity(Channel channel) {
        return ChannelEntity.builder()
                .id(channel.getChannelId())
                .name(channel.getName())
                .siteId(channel.getSiteId())
                .deviceRef(channel.getDeviceRef())
                .deviceType(channel.getDeviceType())
                .updatedAt(channel.getUpdatedAt() != null ? channel.getUpdatedAt() : clock.instant())
                .build();
    }

    private Channel toModel(ChannelEntity entity) {
        return Channel.builder()
                .channelId(entity.getId())
                .name(entity.getName())
                .siteId(entity.getSiteId())
                .deviceRef(entity.getDeviceRef())
                .deviceType(entity.getDeviceType())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
