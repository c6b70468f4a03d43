package com.weatherledger.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An hourly weather observation, keyed by {@code (location, observedAt)}.
 *
 * <p>Numeric fields are boxed: {@code null} means "not measured", which is distinct from a measured zero.
 * The water temperature fields are filled from the nearest telemetry reading, if there was one.
 */
public record Observation(
        String location,
        Instant observedAt,
        Instant scrapedAt,
        Double temperatureF,
        Double dewPointF,
        Integer humidityPct,
        Double windSpeedMph,
        String windDirection,
        Double windGustMph,
        Double pressureIn,
        Double precipAmountIn,
        String condition,
        Double waterTemp0p35mC,
        Double waterTemp2mC,
        Double waterTemp7mC,
        Long waterTempEntryId
) {
    public Observation {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        Objects.requireNonNull(scrapedAt, "scrapedAt is required");
    }

    public Observation withTelemetry(TelemetryReading reading) {
        if (reading == null) {
            return this;
        }
        return new Observation(
                location,
                observedAt,
                scrapedAt,
                temperatureF,
                dewPointF,
                humidityPct,
                windSpeedMph,
                windDirection,
                windGustMph,
                pressureIn,
                precipAmountIn,
                condition,
                reading.depth0p35mC(),
                reading.depth2mC(),
                reading.depth7mC(),
                reading.entryId()
        );
    }

    public boolean hasTelemetry() {
        return waterTempEntryId != null || waterTemp0p35mC != null || waterTemp2mC != null || waterTemp7mC != null;
    }
}
