package dev.devanks.energy.ingestor.mapper;

import dev.devanks.energy.common.model.Reading;
import dev.devanks.energy.ingestor.model.EniscopeReadingsResponse;
import dev.devanks.energy.ingestor.model.EniscopeReadingsResponse.RawReading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Normalizes vendor readings: W to kW, Wh to kWh, epoch or ISO timestamps to {@link Instant}.
 */
@Component
@Slf4j
public class ReadingMapper {

    private static final double WATTS_PER_KILOWATT = 1000.0;

    public List<Reading> toReadings(String channelId, EniscopeReadingsResponse response) {
        if (response == null || response.getRecords() == null) {
            return List.of();
        }
        return response.getRecords().stream()
                .map(raw -> toReading(channelId, raw))
                .toList();
    }

    /**
     * A reading whose timestamp cannot be parsed keeps a {@code null} timestamp so validation can count it.
     */
    public Reading toReading(String channelId, RawReading raw) {
        return Reading.builder()
                .channelId(channelId)
                .timestamp(parseTimestamp(raw.getTs()))
                .energyKwh(toKilo(raw.getEnergyWh()))
                .powerKw(toKilo(raw.getPowerW()))
                .voltageV(raw.getVoltage())
                .currentA(raw.getCurrent())
                .powerFactor(raw.getPowerFactor())
                .temperatureC(raw.getTemperature())
                .build();
    }

    Instant parseTimestamp(String ts) {
        if (ts == null || ts.isBlank()) {
            log.warn("Reading timestamp missing.");
            return null;
        }
        var trimmed = ts.trim();
        try {
            if (trimmed.chars().allMatch(Character::isDigit)) {
                return Instant.ofEpochSecond(Long.parseLong(trimmed));
            }
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("Failed to parse reading timestamp '{}': {}", ts, e.getMessage());
            return null;
        }
    }

    private Double toKilo(Double value) {
        return value == null ? null : value / WATTS_PER_KILOWATT;
    }
}
