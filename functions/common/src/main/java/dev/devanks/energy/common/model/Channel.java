package dev.devanks.energy.common.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Reference data for a metered point. Maintained by the ingestor's metadata sync.
 */
@Value
@Builder(toBuilder = true)
public class Channel {

    String channelId;
    String name;
    String siteId;
    String deviceRef;
    String deviceType;
    Instant updatedAt;
}
