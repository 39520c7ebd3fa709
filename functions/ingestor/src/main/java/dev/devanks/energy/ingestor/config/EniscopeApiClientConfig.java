package dev.devanks.energy.ingestor.config;

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import feign.Logger.Level;
import feign.RequestInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

import static feign.Logger.Level.BASIC;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.springframework.http.HttpHeaders.ACCEPT;
import static org.springframework.http.HttpHeaders.AUTHORIZATION;
import static org.springframework.http.HttpHeaders.USER_AGENT;

/**
 * Feign configuration for the Eniscope client. Not a {@code @Configuration} so the
 * interceptor only applies to this client.
 */
@RequiredArgsConstructor
@Slf4j
public class EniscopeApiClientConfig {

    static final String API_KEY_HEADER = "X-Eniscope-API";

    private final IngestorProperties ingestorProperties;

    @Bean
    public RequestInterceptor eniscopeAuthInterceptor() {
        return template -> {
            var eniscope = ingestorProperties.getEniscope();
            var apiKey = requireResolved(eniscope.getApiKey(), "API key");
            var password = requireResolved(eniscope.getPassword(), "password");

            log.debug("Adding Eniscope authentication headers to request {}", template.path());
            template.header(API_KEY_HEADER, apiKey);
            template.header(AUTHORIZATION, basicAuth(eniscope.getEmail(), password));
            template.header(ACCEPT, "text/json");
            template.header(USER_AGENT, "GCP-Cloud-Function-Energy-Ingestor-Java-Feign/1.0");
        };
    }

    /**
     * The vendor expects the password as an MD5 hex digest inside the Basic credentials.
     */
    static String basicAuth(String email, String password) {
        var passwordDigest = Hashing.md5().hashString(password, UTF_8).toString();
        return "Basic " + BaseEncoding.base64().encode((email + ":" + passwordDigest).getBytes(UTF_8));
    }

    private String requireResolved(String value, String name) {
        if (value == null || value.isBlank() || value.startsWith("sm://")) {
            log.error("Eniscope {} is missing or unresolved. Cannot authenticate request.", name);
            throw new IllegalStateException("Eniscope " + name + " not available for Feign client.");
        }
        return value;
    }

    @Bean
    public Level feignLoggerLevel() {
        return BASIC;
    }
}
