package dev.devanks.energy.analyzer.model;

/**
 * Declared from most to least severe so natural order sorts the worst first.
 */
public enum Severity {
    HIGH,
    MEDIUM,
    LOW
}
