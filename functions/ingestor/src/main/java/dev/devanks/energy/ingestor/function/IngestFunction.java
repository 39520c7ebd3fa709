package dev.devanks.energy.ingestor.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.ingestor.config.IngestorProperties;
import dev.devanks.energy.ingestor.model.IngestionResult;
import dev.devanks.energy.ingestor.service.ChannelSyncService;
import dev.devanks.energy.ingestor.service.IngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class IngestFunction {

    static final String MODE_INGEST = "ingest";
    static final String MODE_BACKFILL = "backfill";
    static final String MODE_SYNC_CHANNELS = "sync-channels";

    private final IngestionService ingestionService;
    private final ChannelSyncService channelSyncService;
    private final IngestorProperties properties;
    private final Clock clock;

    /**
     * Main function bean: ingestTelemetry.
     * <p>
     * Payload keys (all optional): {@code mode}, {@code channelIds}, {@code startDate},
     * {@code endDate} (exclusive, YYYY-MM-DD) and {@code validate}. With no dates, yesterday is ingested.
     */
    @Bean
    public Function<HashMap<String, Object>, String> ingestTelemetry() {
        return payload -> {
            log.info("ingestTelemetry function triggered with payload: {}", payload);
            try {
                return dispatch(payload == null ? Map.of() : payload).block();
            } catch (Exception e) {
                log.error("Error processing ingestion payload: {}. Details: {}", payload, e.getMessage(), e);
                return "Ingestion failed: " + e.getMessage();
            }
        };
    }

    @VisibleForTesting
    Mono<String> dispatch(Map<String, Object> payload) {
        var mode = String.valueOf(payload.getOrDefault("mode", MODE_INGEST));
        if (MODE_SYNC_CHANNELS.equals(mode)) {
            var siteId = String.valueOf(payload.getOrDefault("siteId", properties.getSiteId()));
            return channelSyncService.syncChannels(siteId)
                    .map(count -> String.format("Channel sync for site %s complete: %d channel(s) upserted.", siteId, count));
        }
        if (!MODE_INGEST.equals(mode) && !MODE_BACKFILL.equals(mode)) {
            return Mono.error(new IllegalArgumentException("Unknown mode '" + mode + "'. Use ingest, backfill or sync-channels."));
        }

        var endDate = parseDate(payload, "endDate", LocalDate.now(clock.withZone(ZoneId.of(properties.getPipeline().getZone()))));
        var startDate = parseDate(payload, "startDate", endDate.minusDays(1));
        if (!startDate.isBefore(endDate)) {
            return Mono.error(new IllegalArgumentException("startDate " + startDate + " must be before endDate " + endDate));
        }
        var validate = parseValidate(payload);

        log.info("{} requested for [{}, {}) with validation {}", mode, startDate, endDate, validate ? "on" : "off");
        return ingestionService.resolveChannelIds(channelIds(payload))
                .flatMap(channelIds -> {
                    if (channelIds.isEmpty()) {
                        return Mono.error(new IllegalStateException("No channels configured or stored for site " + properties.getSiteId()));
                    }
                    return MODE_BACKFILL.equals(mode)
                            ? ingestionService.backfillChannels(channelIds, startDate, endDate, validate)
                            : ingestionService.ingestChannels(channelIds, startDate, endDate, validate);
                })
                .map(IngestionResult::getMessage);
    }

    private LocalDate parseDate(Map<String, Object> payload, String key, LocalDate defaultDate) {
        var value = payload.get(key);
        return value == null ? defaultDate : LocalDate.parse(value.toString());
    }

    private boolean parseValidate(Map<String, Object> payload) {
        var value = payload.get("validate");
        return value == null ? properties.getPipeline().isValidate() : Boolean.parseBoolean(value.toString());
    }

    private List<String> channelIds(Map<String, Object> payload) {
        var value = payload.get("channelIds");
        if (value instanceof List) {
            return ((List<?>) value).stream().map(String::valueOf).toList();
        }
        if (value != null && !value.toString().isBlank()) {
            return List.of(value.toString().split("\\s*,\\s*"));
        }
        return List.of();
    }
}
