package dev.devanks.energy.ingestor.service;

import dev.devanks.energy.common.model.Channel;
import dev.devanks.energy.common.model.IngestionRun;
import dev.devanks.energy.common.model.Reading;
import dev.devanks.energy.ingestor.config.IngestorProperties;
import dev.devanks.energy.ingestor.exception.PermanentSourceException;
import dev.devanks.energy.ingestor.exception.TransientSourceException;
import dev.devanks.energy.ingestor.model.IngestionResult;
import dev.devanks.energy.ingestor.source.TelemetrySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionService Unit Tests")
class IngestionServiceTest {

    private static final String CHANNEL = "162119";
    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final LocalDate DAY1 = LocalDate.of(2024, 3, 4);
    private static final Instant DAY1_START = Instant.parse("2024-03-04T00:00:00Z");
    private static final Instant DAY2_START = Instant.parse("2024-03-05T00:00:00Z");
    private static final Instant DAY3_START = Instant.parse("2024-03-06T00:00:00Z");

    @Mock
    private TelemetrySource mockTelemetrySource;

    private InMemoryTelemetryStore store;
    private IngestorProperties properties;
    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        store = new InMemoryTelemetryStore();
        properties = new IngestorProperties();
        properties.setSiteId("23271");
        properties.getPipeline().setRateLimitDelay(Duration.ZERO);
        var retryPolicy = RetryPolicy.builder()
                .maxAttempts(3)
                .baseDelay(Duration.ofSeconds(8))
                .multiplier(2.0)
                .maxDelay(Duration.ofSeconds(60))
                .build();
        ingestionService = new IngestionService(mockTelemetrySource, store, new ReadingValidator(), retryPolicy,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Reading reading(Instant ts, Double powerKw) {
        return Reading.builder().channelId(CHANNEL).timestamp(ts).powerKw(powerKw).energyKwh(0.25).build();
    }

    @Test
    @DisplayName("ingest: negative power is rejected and counted, the valid reading is stored")
    void ingest_negativePower_rejectedAndCounted() {
        when(mockTelemetrySource.fetchReadings(eq(CHANNEL), eq(DAY1_START), eq(DAY2_START), any()))
                .thenReturn(List.of(
                        reading(DAY1_START.plusSeconds(900), -0.5),
                        reading(DAY1_START.plusSeconds(1800), 2.0)));

        StepVerifier.create(ingestionService.ingest(CHANNEL, DAY1, DAY1.plusDays(1), true))
                .assertNext(run -> {
                    assertThat(run.getStatus()).isEqualTo(IngestionRun.Status.SUCCESS);
                    assertThat(run.getFetchedCount()).isEqualTo(2);
                    assertThat(run.getInsertedCount()).isEqualTo(1);
                    assertThat(run.getRejectedCount()).isEqualTo(1);
                })
                .verifyComplete();

        assertThat(store.readings()).singleElement()
                .satisfies(stored -> assertThat(stored.getPowerKw()).isEqualTo(2.0));
        assertThat(store.runs()).hasSize(1);
    }

    @Test
    @DisplayName("ingest: running the same window twice inserts nothing the second time")
    void ingest_twice_isIdempotent() {
        when(mockTelemetrySource.fetchReadings(eq(CHANNEL), any(), any(), any()))
                .thenReturn(List.of(
                        reading(DAY1_START, 1.0),
                        reading(DAY1_START.plusSeconds(900), 1.5)));

        StepVerifier.create(ingestionService.ingest(CHANNEL, DAY1, DAY1.plusDays(1), true))
                .assertNext(run -> assertThat(run.getInsertedCount()).isEqualTo(2))
                .verifyComplete();
        StepVerifier.create(ingestionService.ingest(CHANNEL, DAY1, DAY1.plusDays(1), true))
                .assertNext(run -> {
                    assertThat(run.getFetchedCount()).isEqualTo(2);
                    assertThat(run.getInsertedCount()).isZero();
                    assertThat(run.getStatus()).isEqualTo(IngestionRun.Status.SUCCESS);
                })
                .verifyComplete();

        assertThat(store.readings()).hasSize(2);
        assertThat(store.runs()).hasSize(2);
    }

    @Test
    @DisplayName("ingest: readings stamped in the future are never stored")
    void ingest_futureTimestamp_rejected() {
        when(mockTelemetrySource.fetchReadings(eq(CHANNEL), any(), any(), any()))
                .thenReturn(List.of(reading(NOW.plusSeconds(3600), 1.0), reading(NOW.minusSeconds(3600), 1.0)));

        StepVerifier.create(ingestionService.ingestRange(CHANNEL, NOW.minus(Duration.ofDays(1)), NOW, true))
                .assertNext(run -> {
                    assertThat(run.getInsertedCount()).isEqualTo(1);
                    assertThat(run.getRejectedCount()).isEqualTo(1);
                })
                .verifyComplete();

        assertThat(store.readings()).allSatisfy(r -> assertThat(r.getTimestamp()).isBeforeOrEqualTo(NOW));
    }

    @Test
    @DisplayName("ingest: without validation negative power is stored but unkeyed readings are still dropped")
    void ingest_validationDisabled() {
        when(mockTelemetrySource.fetchReadings(eq(CHANNEL), any(), any(), any()))
                .thenReturn(List.of(reading(DAY1_START, -1.0), reading(null, 1.0)));

        StepVerifier.create(ingestionService.ingest(CHANNEL, DAY1, DAY1.plusDays(1), false))
                .assertNext(run -> {
                    assertThat(run.getInsertedCount()).isEqualTo(1);
                    assertThat(run.getRejectedCount()).isEqualTo(1);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("ingest: a multi-day range produces one run per day, in order")
    void ingest_multiDay_oneRunPerWindow() {
        when(mockTelemetrySource.fetchReadings(eq(CHANNEL), any(), any(), any())).thenReturn(List.of());

        StepVerifier.create(ingestionService.ingest(CHANNEL, DAY1, DAY1.plusDays(3), true))
                .assertNext(run -> assertThat(run.getWindowStart()).isEqualTo(DAY1_START))
                .assertNext(run -> assertThat(run.getWindowStart()).isEqualTo(DAY2_START))
                .assertNext(run -> assertThat(run.getWindowStart()).isEqualTo(DAY3_START))
                .verifyComplete();
    }

    @Test
    @DisplayName("ingest: transient failure is retried after the base delay and then succeeds")
    void ingest_transientFailure_retriedWithBackoff() {
        when(mockTelemetrySource.fetchReadings(eq(CHANNEL), any(), any(), any()))
                .thenThrow(new TransientSourceException("429 Too Many Requests", null))
                .thenReturn(List.of(reading(DAY1_START, 1.0)));

        StepVerifier.withVirtualTime(() -> ingestionService.ingest(CHANNEL, DAY1, DAY1.plusDays(1), true))
                .expectSubscription()
                .expectNoEvent(Duration.ofSeconds(7))
                .thenAwait(Duration.ofSeconds(1))
                .assertNext(run -> {
                    assertThat(run.getStatus()).isEqualTo(IngestionRun.Status.SUCCESS);
                    assertThat(run.getInsertedCount()).isEqualTo(1);
                })
                .verifyComplete();

        verify(mockTelemetrySource, times(2)).fetchReadings(eq(CHANNEL), any(), any(), any());
    }

    @Test
    @DisplayName("ingest: exhausted retries mark the window failed and the next window still runs")
    void ingest_retriesExhausted_windowFailsAndPipelineContinues() {
        var transientError = new TransientSourceException("connection reset", null);
        when(mockTelemetrySource.fetchReadings(eq(CHANNEL), eq(DAY1_START), any(), any())).thenThrow(transientError);
        when(mockTelemetrySource.fetchReadings(eq(CHANNEL), eq(DAY2_START), any(), any()))
                .thenReturn(List.of(reading(DAY2_START, 1.0)));

        StepVerifier.withVirtualTime(() -> ingestionService.ingest(CHANNEL, DAY1, DAY1.plusDays(2), true))
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(8 + 16))
                .assertNext(run -> {
                    assertThat(run.getStatus()).isEqualTo(IngestionRun.Status.FAILURE);
                    assertThat(run.getError()).contains("connection reset");
                })
                .assertNext(run -> assertThat(run.getStatus()).isEqualTo(IngestionRun.Status.SUCCESS))
                .verifyComplete();

        verify(mockTelemetrySource, times(3)).fetchReadings(eq(CHANNEL), eq(DAY1_START), any(), any());
        assertThat(store.runs()).extracting(IngestionRun::getStatus)
                .containsExactly(IngestionRun.Status.FAILURE, IngestionRun.Status.SUCCESS);
    }

    @Test
    @DisplayName("ingest: permanent failure fails the window without retrying")
    void ingest_permanentFailure_noRetry() {
        when(mockTelemetrySource.fetchReadings(eq(CHANNEL), any(), any(), any()))
                .thenThrow(new PermanentSourceException("401 Unauthorized"));

        StepVerifier.create(ingestionService.ingest(CHANNEL, DAY1, DAY1.plusDays(1), true))
                .assertNext(run -> {
                    assertThat(run.getStatus()).isEqualTo(IngestionRun.Status.FAILURE);
                    assertThat(run.getError()).startsWith("PermanentSourceException").contains("401");
                })
                .verifyComplete();

        verify(mockTelemetrySource, times(1)).fetchReadings(eq(CHANNEL), any(), any(), any());
    }

    @Test
    @DisplayName("ingest: a store write failure aborts the window as failed")
    void ingest_persistenceFailure_windowFails() {
        when(mockTelemetrySource.fetchReadings(eq(CHANNEL), any(), any(), any()))
                .thenReturn(List.of(reading(DAY1_START, 1.0), reading(DAY1_START.plusSeconds(900), 1.0)));
        store.failWrites();

        StepVerifier.create(ingestionService.ingest(CHANNEL, DAY1, DAY1.plusDays(1), true))
                .assertNext(run -> {
                    assertThat(run.getStatus()).isEqualTo(IngestionRun.Status.FAILURE);
                    assertThat(run.getFetchedCount()).isEqualTo(2);
                    assertThat(run.getInsertedCount()).isZero();
                    assertThat(run.getError()).contains("PersistenceException");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("ingest: consecutive source calls are spaced by the rate-limit delay")
    void ingest_rateLimitDelayBetweenWindows() {
        properties.getPipeline().setRateLimitDelay(Duration.ofSeconds(1));
        when(mockTelemetrySource.fetchReadings(eq(CHANNEL), any(), any(), any())).thenReturn(List.of());

        StepVerifier.withVirtualTime(() -> ingestionService.ingest(CHANNEL, DAY1, DAY1.plusDays(3), true))
                .expectSubscription()
                .expectNextCount(1)
                .expectNoEvent(Duration.ofMillis(999))
                .thenAwait(Duration.ofMillis(1))
                .expectNextCount(1)
                .thenAwait(Duration.ofSeconds(1))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    @DisplayName("backfillGaps: only windows without a successful run are fetched again")
    void backfillGaps_refetchesOnlyUncoveredWindows() {
        store.recordIngestionRun(IngestionRun.builder().channelId(CHANNEL)
                .windowStart(DAY1_START).windowEnd(DAY2_START).status(IngestionRun.Status.SUCCESS).build()).block();
        store.recordIngestionRun(IngestionRun.builder().channelId(CHANNEL)
                .windowStart(DAY2_START).windowEnd(DAY3_START).status(IngestionRun.Status.FAILURE).error("boom").build()).block();
        when(mockTelemetrySource.fetchReadings(eq(CHANNEL), eq(DAY2_START), eq(DAY3_START), any()))
                .thenReturn(List.of(reading(DAY2_START, 1.0)));

        StepVerifier.create(ingestionService.backfillGaps(CHANNEL, DAY1, DAY1.plusDays(2), true))
                .assertNext(run -> {
                    assertThat(run.getWindowStart()).isEqualTo(DAY2_START);
                    assertThat(run.getStatus()).isEqualTo(IngestionRun.Status.SUCCESS);
                })
                .verifyComplete();

        verify(mockTelemetrySource, times(1)).fetchReadings(any(), any(), any(), any());
        StepVerifier.create(ingestionService.findGaps(CHANNEL, DAY1_START, DAY3_START)).verifyComplete();
    }

    @Test
    @DisplayName("ingestChannels: aggregates runs across channels into one result")
    void ingestChannels_summarizesAllChannels() {
        when(mockTelemetrySource.fetchReadings(any(), any(), any(), any()))
                .thenAnswer(inv -> List.of(Reading.builder()
                        .channelId(inv.getArgument(0, String.class)).timestamp(DAY1_START).powerKw(3.0).build()));

        StepVerifier.create(ingestionService.ingestChannels(List.of("a", "b"), DAY1, DAY1.plusDays(1), true))
                .assertNext(result -> {
                    assertThat(result.getStatus()).isEqualTo(IngestionResult.Status.SUCCESS);
                    assertThat(result.getChannels()).isEqualTo(2);
                    assertThat(result.getWindows()).isEqualTo(2);
                    assertThat(result.getInserted()).isEqualTo(2);
                    assertThat(result.getErrorDetails()).isNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("resolveChannelIds: falls back from request to configuration to stored channels")
    void resolveChannelIds_precedence() {
        store.upsertChannel(Channel.builder().channelId("stored").siteId("23271").build()).block();

        StepVerifier.create(ingestionService.resolveChannelIds(List.of("requested")))
                .expectNext(List.of("requested")).verifyComplete();
        StepVerifier.create(ingestionService.resolveChannelIds(null))
                .expectNext(List.of("stored")).verifyComplete();

        properties.setChannelIds(List.of("configured"));
        StepVerifier.create(ingestionService.resolveChannelIds(List.of()))
                .expectNext(List.of("configured")).verifyComplete();
    }
}
