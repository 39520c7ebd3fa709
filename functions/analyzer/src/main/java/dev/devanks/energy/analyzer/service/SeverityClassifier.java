package dev.devanks.energy.analyzer.service;

import dev.devanks.energy.analyzer.model.AnalysisSettings;
import dev.devanks.energy.analyzer.model.Severity;
import org.springframework.stereotype.Component;

/**
 * Grades excess energy against one hour of the site's typical load, falling back to absolute kWh tiers
 * when the site load is unknown.
 */
@Component
public class SeverityClassifier {

    public Severity classify(double excessKwh, double siteTypicalKw, AnalysisSettings settings) {
        if (siteTypicalKw > 0) {
            double ratio = excessKwh / siteTypicalKw;
            if (ratio >= settings.getSeverityHighRatio()) {
                return Severity.HIGH;
            }
            return ratio >= settings.getSeverityMediumRatio() ? Severity.MEDIUM : Severity.LOW;
        }
        if (excessKwh >= settings.getSeverityHighKwh()) {
            return Severity.HIGH;
        }
        return excessKwh >= settings.getSeverityMediumKwh() ? Severity.MEDIUM : Severity.LOW;
    }
}
