package dev.devanks.energy.ingestor.service;

import dev.devanks.energy.ingestor.exception.TransientSourceException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Exponential backoff for source calls. Only {@link TransientSourceException} is retried.
 * Delays run on Reactor's timer, so tests drive them with virtual time.
 */
@Value
@Builder
@Slf4j
public class RetryPolicy {

    /**
     * Total attempts including the first call.
     */
    @Builder.Default
    int maxAttempts = 3;
    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(8);
    @Builder.Default
    double multiplier = 2.0;
    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(60);

    /**
     * Delay before retry number {@code retryIndex} (zero based): {@code baseDelay * multiplier^retryIndex}, capped.
     */
    public Duration delayBeforeRetry(long retryIndex) {
        double millis = baseDelay.toMillis() * Math.pow(multiplier, retryIndex);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public Retry toRetry() {
        return Retry.from(signals -> signals.concatMap(signal -> {
            var failure = signal.failure();
            long retriesSoFar = signal.totalRetries();
            if (!(failure instanceof TransientSourceException) || retriesSoFar + 1 >= maxAttempts) {
                return Mono.<Long>error(failure);
            }
            var delay = delayBeforeRetry(retriesSoFar);
            log.warn("Attempt {}/{} failed ({}). Retrying in {}", retriesSoFar + 1, maxAttempts, failure.getMessage(), delay);
            return Mono.delay(delay);
        }));
    }
}
