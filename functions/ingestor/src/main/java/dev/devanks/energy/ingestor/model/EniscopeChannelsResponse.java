package dev.devanks.energy.ingestor.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EniscopeChannelsResponse {

    @JsonProperty("channels")
    @JsonAlias({"data", "records"})
    private List<RawChannel> channels;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RawChannel {

        @JsonProperty("channelId")
        @JsonAlias({"dataChannelId", "id"})
        private String channelId;

        @JsonProperty("channelName")
        @JsonAlias("name")
        private String name;

        @JsonProperty("deviceId")
        @JsonAlias("device_id")
        private String deviceRef;

        @JsonProperty("deviceTypeName")
        @JsonAlias("deviceType")
        private String deviceType;
    }
}
