package dev.devanks.energy.analyzer.model;

public enum Direction {
    ABOVE,
    BELOW
}
