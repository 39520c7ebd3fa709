package dev.devanks.energy.ingestor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "ingestor")
public class IngestorProperties {

    /**
     * Site whose channels are ingested when a trigger names none.
     */
    @NotEmpty
    private String siteId;

    /**
     * Fixed channel list; when empty the site's stored channels are used.
     */
    private List<String> channelIds = new ArrayList<>();

    @NotNull
    @Valid
    private EniscopeProperties eniscope = new EniscopeProperties();

    @NotNull
    @Valid
    private PipelineProperties pipeline = new PipelineProperties();

    @NotNull
    @Valid
    private RetryProperties retry = new RetryProperties();

    @Data
    @Validated
    public static class EniscopeProperties {
        @NotEmpty
        @URL
        private String url;
        @NotEmpty
        private String apiKey; // injected via sm://
        @NotEmpty
        private String email;
        @NotEmpty
        private String password; // injected via sm://
    }

    @Data
    @Validated
    public static class PipelineProperties {
        /**
         * Size of each fetch window. Readings are requested from the source one window at a time.
         */
        @NotNull
        private Duration windowSize = Duration.ofDays(1);

        /**
         * Pause between two consecutive source calls for the same channel.
         */
        @NotNull
        private Duration rateLimitDelay = Duration.ofSeconds(1);

        /**
         * Sampling resolution requested from the source.
         */
        @NotNull
        private Duration resolution = Duration.ofMinutes(15);

        /**
         * Zone used to turn trigger dates into window boundaries.
         */
        @NotEmpty
        private String zone = "UTC";

        @Min(1)
        private int channelConcurrency = 4;

        private boolean validate = true;
    }

    @Data
    @Validated
    public static class RetryProperties {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(8);
        @DecimalMin("1.0")
        private double multiplier = 2.0;
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(60);
    }
}
