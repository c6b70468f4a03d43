package com.weatherledger.service.telemetry;

import com.weatherledger.core.model.TelemetryReading;
import com.weatherledger.ingest.telemetry.TelemetryFeedParser;
import com.weatherledger.ingest.telemetry.TelemetrySource;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;

/**
 * Fetches the most recent water-temperature readings from a ThingSpeak channel feed. One attempt per
 * call; any failure is logged and reported as "no readings".
 */
public final class ThingSpeakTelemetrySource implements TelemetrySource {
    private static final Logger LOGGER = Logger.getLogger(ThingSpeakTelemetrySource.class.getName());

    private final HttpClient httpClient;
    private final URI feedUri;
    private final Duration timeout;

    public ThingSpeakTelemetrySource(HttpClient httpClient, String url, int results, Duration timeout) {
        this.httpClient = httpClient;
        this.feedUri = URI.create(url + (url.contains("?") ? "&" : "?") + "results=" + results);
        this.timeout = timeout;
    }

    public URI feedUri() {
        return feedUri;
    }

    @Override
    public List<TelemetryReading> fetchReadings() {
        HttpRequest request = HttpRequest.newBuilder(feedUri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                LOGGER.warning("Telemetry feed " + feedUri + " returned status " + response.statusCode());
                return List.of();
            }
            List<TelemetryReading> readings = TelemetryFeedParser.parse(response.body());
            LOGGER.info("Fetched " + readings.size() + " telemetry readings from " + feedUri);
            return readings;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted fetching telemetry feed " + feedUri);
            return List.of();
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.warning("Telemetry feed " + feedUri + " unavailable: " + e.getMessage());
            return List.of();
        }
    }
}
