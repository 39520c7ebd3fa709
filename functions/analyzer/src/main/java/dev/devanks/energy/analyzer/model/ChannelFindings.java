package dev.devanks.energy.analyzer.model;

import dev.devanks.energy.common.model.Channel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ChannelFindings {
    Channel channel;
    @Singular
    List<AnomalyEvent> anomalies;
    @Singular
    List<SpikeEvent> spikes;
    @Singular
    List<HealthIssue> healthIssues;
    WasteSummary waste;
}
