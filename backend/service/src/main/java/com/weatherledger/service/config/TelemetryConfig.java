package com.weatherledger.service.config;

import java.time.Duration;

public record TelemetryConfig(String url, Integer results, Duration timeout) {
    public static final String DEFAULT_URL = "https://api.thingspeak.com/channels/521315/feeds.json";
    public static final int DEFAULT_RESULTS = 300;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public static TelemetryConfig defaults() {
        return new TelemetryConfig(DEFAULT_URL, DEFAULT_RESULTS, DEFAULT_TIMEOUT);
    }

    public TelemetryConfig withDefaults() {
        return new TelemetryConfig(
                url == null || url.isBlank() ? DEFAULT_URL : url,
                results == null || results < 1 ? DEFAULT_RESULTS : results,
                timeout == null || timeout.isNegative() || timeout.isZero() ? DEFAULT_TIMEOUT : timeout
        );
    }
}
