package com.weatherledger.ingest.telemetry;

import com.weatherledger.core.model.TelemetryReading;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public final class TelemetryMatcher {
    private TelemetryMatcher() {
    }

    /**
     * The reading nearest to {@code target} by absolute time distance, in one pass over unsorted input.
     * On a tie the earliest reading in list order wins.
     */
    public static Optional<TelemetryReading> closest(Instant target, List<TelemetryReading> readings) {
        if (target == null || readings == null || readings.isEmpty()) {
            return Optional.empty();
        }
        TelemetryReading best = null;
        Duration bestDistance = null;
        for (TelemetryReading reading : readings) {
            if (reading == null) {
                continue;
            }
            Duration distance = Duration.between(reading.recordedAt(), target).abs();
            if (bestDistance == null || distance.compareTo(bestDistance) < 0) {
                best = reading;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }
}
