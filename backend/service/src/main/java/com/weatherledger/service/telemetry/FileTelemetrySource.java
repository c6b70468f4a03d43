package com.weatherledger.service.telemetry;

import com.weatherledger.core.model.TelemetryReading;
import com.weatherledger.ingest.telemetry.TelemetryFeedParser;
import com.weatherledger.ingest.telemetry.TelemetrySource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads a saved feed document instead of calling the channel. A file named on the command line that
 * does not exist is a usage mistake and fails the run; an unreadable feed inside it degrades to no readings.
 */
public final class FileTelemetrySource implements TelemetrySource {
    private static final Logger LOGGER = Logger.getLogger(FileTelemetrySource.class.getName());

    private final Path file;

    public FileTelemetrySource(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Telemetry file not found: " + file);
        }
        this.file = file;
    }

    @Override
    public List<TelemetryReading> fetchReadings() {
        try {
            return TelemetryFeedParser.parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.warning("Telemetry file " + file + " unreadable: " + e.getMessage());
            return List.of();
        }
    }
}
