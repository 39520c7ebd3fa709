package dev.devanks.energy.ingestor.source;

import dev.devanks.energy.common.model.Channel;
import dev.devanks.energy.common.model.Reading;
import dev.devanks.energy.ingestor.client.EniscopeApiClient;
import dev.devanks.energy.ingestor.exception.IngestionException;
import dev.devanks.energy.ingestor.exception.PermanentSourceException;
import dev.devanks.energy.ingestor.exception.TransientSourceException;
import dev.devanks.energy.ingestor.mapper.ChannelMapper;
import dev.devanks.energy.ingestor.mapper.ReadingMapper;
import feign.FeignException;
import feign.RetryableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class EniscopeTelemetrySource implements TelemetrySource {

    static final String SUMMARIZE_ACTION = "summarize";
    static final List<String> FIELDS = List.of("E", "P", "V", "I", "PF", "T");

    private final EniscopeApiClient eniscopeApiClient;
    private final ReadingMapper readingMapper;
    private final ChannelMapper channelMapper;
    private final Clock clock;

    @Override
    public List<Reading> fetchReadings(String channelId, Instant windowStart, Instant windowEnd, Duration resolution) {
        log.debug("Fetching readings for channel {} over [{}, {}) at {}s resolution",
                channelId, windowStart, windowEnd, resolution.toSeconds());
        try {
            var response = eniscopeApiClient.getReadings(channelId, SUMMARIZE_ACTION, resolution.toSeconds(),
                    List.of(windowStart.getEpochSecond(), windowEnd.getEpochSecond()), FIELDS);
            var readings = readingMapper.toReadings(channelId, response);
            log.debug("Received {} readings for channel {}", readings.size(), channelId);
            return readings;
        } catch (FeignException e) {
            throw translate(e, "readings for channel " + channelId);
        }
    }

    @Override
    public List<Channel> fetchChannels(String siteId) {
        try {
            return channelMapper.toChannels(siteId, eniscopeApiClient.getChannels(siteId), clock.instant());
        } catch (FeignException e) {
            throw translate(e, "channels for site " + siteId);
        }
    }

    /**
     * 429, 5xx and I/O failures are transient; any other status means the request itself is wrong.
     */
    static IngestionException translate(FeignException e, String what) {
        int status = e.status();
        var message = "Error fetching " + what + " from Eniscope (status " + status + "): " + e.getMessage();
        if (e instanceof RetryableException || status <= 0 || status == 429 || status >= 500) {
            log.warn("Transient source failure: {}", message);
            return new TransientSourceException(message, e);
        }
        log.error("Permanent source failure: {}", message);
        return new PermanentSourceException(message, e);
    }
}
