package dev.devanks.energy.analyzer.function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.analyzer.config.AnalyzerProperties;
import dev.devanks.energy.analyzer.model.AnalysisReport;
import dev.devanks.energy.analyzer.model.AnalysisSettings;
import dev.devanks.energy.analyzer.service.AnalysisService;
import dev.devanks.energy.analyzer.service.ReportPeriods;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyzeFunction {

    private final AnalysisService analysisService;
    private final AnalyzerProperties properties;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    /**
     * Main function bean: analyzeSite. Returns the report as JSON.
     * <p>
     * Payload keys (all optional): {@code siteId}, {@code reportStart} and {@code reportEnd}
     * (exclusive, YYYY-MM-DD in the site's zone), {@code baselineWeeks}, {@code iqrMultiplier},
     * {@code spikeMultiplier} and {@code unitRate}. With no dates, the last complete week is analyzed.
     */
    @Bean
    public Function<HashMap<String, Object>, String> analyzeSite() {
        return payload -> {
            log.info("analyzeSite function triggered with payload: {}", payload);
            try {
                return toJson(dispatch(payload == null ? Map.of() : payload).block());
            } catch (Exception e) {
                log.error("Error processing analysis payload: {}. Details: {}", payload, e.getMessage(), e);
                return "Analysis failed: " + e.getMessage();
            }
        };
    }

    @VisibleForTesting
    Mono<AnalysisReport> dispatch(Map<String, Object> payload) {
        var settings = applyOverrides(properties.toSettings(), payload);
        var violations = validator.validate(settings);
        if (!violations.isEmpty()) {
            return Mono.error(new IllegalArgumentException("Invalid analysis overrides: " + describe(violations)));
        }
        var siteId = String.valueOf(payload.getOrDefault("siteId", properties.getSiteId()));
        var start = payload.get("reportStart");
        var end = payload.get("reportEnd");
        if (start == null && end == null) {
            return analysisService.analyzeLastWeek(siteId, settings);
        }
        if (start == null || end == null) {
            return Mono.error(new IllegalArgumentException("reportStart and reportEnd must be given together"));
        }
        var zone = settings.getTimezone();
        var report = ReportPeriods.ofDates(LocalDate.parse(start.toString()), LocalDate.parse(end.toString()), zone);
        return analysisService.analyze(siteId, report, ReportPeriods.baselineFor(report, settings.getBaselineWeeks(), zone), settings);
    }

    @VisibleForTesting
    static AnalysisSettings applyOverrides(AnalysisSettings settings, Map<String, Object> payload) {
        var builder = settings.toBuilder();
        if (payload.get("baselineWeeks") != null) {
            builder.baselineWeeks(Integer.parseInt(payload.get("baselineWeeks").toString()));
        }
        if (payload.get("iqrMultiplier") != null) {
            builder.iqrMultiplier(Double.parseDouble(payload.get("iqrMultiplier").toString()));
        }
        if (payload.get("spikeMultiplier") != null) {
            builder.spikeMultiplier(Double.parseDouble(payload.get("spikeMultiplier").toString()));
        }
        if (payload.get("unitRate") != null) {
            builder.unitRate(Double.parseDouble(payload.get("unitRate").toString()));
        }
        return builder.build();
    }

    private static String describe(Set<ConstraintViolation<AnalysisSettings>> violations) {
        return violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining("; "));
    }

    private String toJson(AnalysisReport report) throws JsonProcessingException {
        return objectMapper.writeValueAsString(report);
    }
}
