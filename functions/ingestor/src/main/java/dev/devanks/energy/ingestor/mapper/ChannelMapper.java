package dev.devanks.energy.ingestor.mapper;

import dev.devanks.energy.common.model.Channel;
import dev.devanks.energy.ingestor.model.EniscopeChannelsResponse;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

@Component
public class ChannelMapper {

    public List<Channel> toChannels(String siteId, EniscopeChannelsResponse response, Instant syncedAt) {
        if (response == null || response.getChannels() == null) {
            return List.of();
        }
        return response.getChannels().stream()
                .filter(raw -> raw.getChannelId() != null && !raw.getChannelId().isBlank())
                .map(raw -> Channel.builder()
                        .channelId(raw.getChannelId())
                        .name(Objects.requireNonNullElse(raw.getName(), raw.getChannelId()))
                        .siteId(siteId)
                        .deviceRef(raw.getDeviceRef())
                        .deviceType(raw.getDeviceType())
                        .updatedAt(syncedAt)
                        .build())
                .toList();
    }
}
