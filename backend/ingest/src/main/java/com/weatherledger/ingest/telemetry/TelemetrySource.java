package com.weatherledger.ingest.telemetry;

import com.weatherledger.core.model.TelemetryReading;

import java.util.List;

public interface TelemetrySource {
    /**
     * Recent readings in feed order. An unavailable feed yields an empty list rather than an exception.
     */
    List<TelemetryReading> fetchReadings();
}
