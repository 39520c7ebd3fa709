package dev.devanks.energy.ingestor.config;

import dev.devanks.energy.ingestor.service.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@Slf4j
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(IngestorProperties properties) {
        var retry = properties.getRetry();
        log.info("Source retry policy: {} attempts, base delay {}, multiplier {}, max delay {}",
                retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMultiplier(), retry.getMaxDelay());
        return RetryPolicy.builder()
                .maxAttempts(retry.getMaxAttempts())
                .baseDelay(retry.getBaseDelay())
                .multiplier(retry.getMultiplier())
                .maxDelay(retry.getMaxDelay())
                .build();
    }
}
