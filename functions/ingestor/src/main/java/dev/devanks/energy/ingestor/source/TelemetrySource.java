package dev.devanks.energy.ingestor.source;

import dev.devanks.energy.common.model.Channel;
import dev.devanks.energy.common.model.Reading;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Blocking access to a remote telemetry provider. Implementations return normalized readings and
 * signal failures with {@link dev.devanks.energy.ingestor.exception.TransientSourceException} or
 * {@link dev.devanks.energy.ingestor.exception.PermanentSourceException}.
 */
public interface TelemetrySource {

    List<Reading> fetchReadings(String channelId, Instant windowStart, Instant windowEnd, Duration resolution);

    List<Channel> fetchChannels(String siteId);
}
