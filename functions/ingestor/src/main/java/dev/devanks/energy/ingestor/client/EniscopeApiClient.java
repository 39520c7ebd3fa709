package dev.devanks.energy.ingestor.client;

import dev.devanks.energy.ingestor.config.EniscopeApiClientConfig;
import dev.devanks.energy.ingestor.model.EniscopeChannelsResponse;
import dev.devanks.energy.ingestor.model.EniscopeReadingsResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

/**
 * Feign client for the Eniscope Core API.
 * Authentication is handled by EniscopeApiClientConfig.
 */
@FeignClient(name = "eniscope-api",
        url = "${ingestor.eniscope.url}",
        configuration = EniscopeApiClientConfig.class)
public interface EniscopeApiClient {

    @GetMapping("/readings/{channelId}")
    EniscopeReadingsResponse getReadings(@PathVariable("channelId") String channelId,
                                         @RequestParam("action") String action,
                                         @RequestParam("res") long resolutionSeconds,
                                         @RequestParam("daterange[]") List<Long> dateRange,
                                         @RequestParam("fields[]") List<String> fields);

    @GetMapping("/channels")
    EniscopeChannelsResponse getChannels(@RequestParam("organization") String organizationId);
}
