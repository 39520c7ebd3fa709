package dev.devanks.energy.analyzer.model;

import lombok.Value;

import java.time.Instant;

/**
 * Site-wide facts every per-channel detector needs.
 */
@Value
public class AnalysisContext {
    AnalysisSettings settings;
    ReportPeriod reportPeriod;
    /**
     * Sum of channel mean loads over the baseline period; 0 when unknown.
     */
    double siteTypicalKw;
    Instant now;
}
