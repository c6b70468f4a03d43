package com.weatherledger.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One forecast hour as published at {@code scrapedAt}. The same hour scraped on two runs yields two
 * distinct forecasts, so the key is {@code (location, forecastAt, scrapedAt)}.
 */
public record Forecast(
        String location,
        Instant forecastAt,
        Instant scrapedAt,
        Double temperatureF,
        Double feelsLikeF,
        Double dewPointF,
        Integer humidityPct,
        Double windSpeedMph,
        String windDirection,
        Double pressureIn,
        Integer precipChancePct,
        Double precipAmountIn,
        Integer cloudCoverPct,
        String condition
) {
    public Forecast {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(forecastAt, "forecastAt is required");
        Objects.requireNonNull(scrapedAt, "scrapedAt is required");
    }
}
