package com.weatherledger.service.config;

import java.nio.file.Path;
import java.time.ZoneId;

/**
 * Settings read from {@code ingest.json}. Any field left out of the file takes its default.
 */
public record IngestConfig(
        String location,
        String timezone,
        String databasePath,
        String eventLogPath,
        Integer forecastHours,
        TelemetryConfig telemetry
) {
    public static final String DEFAULT_LOCATION = "EGLC";
    public static final String DEFAULT_TIMEZONE = "Europe/London";
    public static final String DEFAULT_DATABASE_PATH = "data/weather_data.db";
    public static final String DEFAULT_EVENT_LOG_PATH = "logs/ingest-events.jsonl";
    public static final int DEFAULT_FORECAST_HOURS = 24;

    public static IngestConfig defaults() {
        return new IngestConfig(null, null, null, null, null, null).withDefaults();
    }

    public IngestConfig withDefaults() {
        return new IngestConfig(
                blank(location) ? DEFAULT_LOCATION : location,
                blank(timezone) ? DEFAULT_TIMEZONE : timezone,
                blank(databasePath) ? DEFAULT_DATABASE_PATH : databasePath,
                blank(eventLogPath) ? DEFAULT_EVENT_LOG_PATH : eventLogPath,
                forecastHours == null || forecastHours < 1 ? DEFAULT_FORECAST_HOURS : forecastHours,
                telemetry == null ? TelemetryConfig.defaults() : telemetry.withDefaults()
        );
    }

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }

    public Path database() {
        return Path.of(databasePath);
    }

    public Path eventLog() {
        return Path.of(eventLogPath);
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}
