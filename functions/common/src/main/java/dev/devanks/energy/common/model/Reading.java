package dev.devanks.energy.common.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A single normalized telemetry sample for one channel.
 * <p>
 * Units are fixed: energy in kWh, power in kW, voltage in V, current in A, temperature in °C.
 * Every metric except the timestamp and channel may be absent.
 */
@Value
@Builder(toBuilder = true)
public class Reading {

    String channelId;
    Instant timestamp;
    Double energyKwh;
    Double powerKw;
    Double voltageV;
    Double currentA;
    Double powerFactor;
    Double temperatureC;

    public boolean hasPower() {
        return powerKw != null && Double.isFinite(powerKw);
    }
}
