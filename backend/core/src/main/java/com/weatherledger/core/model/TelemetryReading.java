package com.weatherledger.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One water-temperature sample from the telemetry feed. Depth fields are {@code null} when the
 * sensor reported nothing for that depth.
 */
public record TelemetryReading(
        Instant recordedAt,
        Double depth0p35mC,
        Double depth2mC,
        Double depth7mC,
        Long entryId
) {
    public TelemetryReading {
        Objects.requireNonNull(recordedAt, "recordedAt is required");
    }
}
