package dev.devanks.energy.analyzer.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EventGrouper Unit Tests")
class EventGrouperTest {

    private static final Instant T0 = Instant.parse("2024-01-22T10:00:00Z");

    private static Instant at(int minutes) {
        return T0.plus(Duration.ofMinutes(minutes));
    }

    @Test
    @DisplayName("samples one interval apart merge, a wider gap splits")
    void group_splitsOnGap() {
        var samples = List.of(at(0), at(15), at(30), at(75), at(90));

        var events = EventGrouper.group(samples, Function.identity(), Duration.ofMinutes(15), (a, b) -> true);

        assertThat(events).hasSize(2);
        assertThat(events.get(0)).containsExactly(at(0), at(15), at(30));
        assertThat(events.get(1)).containsExactly(at(75), at(90));
    }

    @Test
    @DisplayName("predicate rejection splits adjacent samples")
    void group_splitsOnPredicate() {
        var samples = List.of(at(0), at(15), at(30));

        var events = EventGrouper.group(samples, Function.identity(), Duration.ofMinutes(15),
                (a, b) -> !b.equals(at(30)));

        assertThat(events).hasSize(2);
        assertThat(events.get(1)).containsExactly(at(30));
    }

    @Test
    @DisplayName("no samples, no events")
    void group_empty() {
        assertThat(EventGrouper.group(List.<Instant>of(), Function.identity(), Duration.ofMinutes(15), (a, b) -> true))
                .isEmpty();
    }
}
