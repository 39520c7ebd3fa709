package dev.devanks.energy.ingestor.service;

import dev.devanks.energy.common.model.Reading;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Decides whether a fetched reading may be stored.
 */
@Component
public class ReadingValidator {

    /**
     * @return the rejection reason, or empty if the reading is acceptable.
     */
    public Optional<String> validate(Reading reading, Instant now) {
        if (reading.getTimestamp() == null) {
            return Optional.of("Missing or unparseable timestamp");
        }
        var power = reading.getPowerKw();
        if (power != null && !Double.isFinite(power)) {
            return Optional.of("Non-finite power value: " + power);
        }
        if (power != null && power < 0) {
            return Optional.of("Negative power: " + power + " kW");
        }
        if (reading.getTimestamp().isAfter(now)) {
            return Optional.of("Future timestamp: " + reading.getTimestamp());
        }
        return Optional.empty();
    }
}
