package dev.devanks.energy.ingestor.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Raw readings payload as returned by the vendor. Never used past the mapper.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EniscopeReadingsResponse {

    @JsonProperty("records")
    @JsonAlias({"readings", "data"})
    private List<RawReading> records;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RawReading {

        // Epoch seconds or ISO-8601, depending on the endpoint.
        @JsonProperty("ts")
        @JsonAlias({"t", "timestamp"})
        private String ts;

        @JsonProperty("E")
        private Double energyWh;

        @JsonProperty("P")
        private Double powerW;

        @JsonProperty("V")
        private Double voltage;

        @JsonProperty("I")
        private Double current;

        @JsonProperty("PF")
        private Double powerFactor;

        @JsonProperty("T")
        private Double temperature;
    }
}
