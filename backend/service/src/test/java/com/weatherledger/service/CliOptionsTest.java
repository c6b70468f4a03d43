package com.weatherledger.service;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CliOptionsTest {
    @Test
    void defaultsToActualModeAndConfigDirectory() {
        CliOptions options = CliOptions.parse(new String[]{"--observations", "obs.json"});

        assertEquals(CliOptions.Mode.ACTUAL, options.mode());
        assertEquals(Path.of("config"), options.configDir());
        assertEquals(Path.of("obs.json"), options.observations());
        assertNull(options.location());
        assertNull(options.database());
        assertNull(options.telemetry());
        assertFalse(options.help());
    }

    @Test
    void bothModeNeedsBothBatches() {
        CliOptions options = CliOptions.parse(new String[]{
                "--mode", "Both", "--observations", "o.json", "--forecasts", "f.json",
                "--location", "EGLL", "--db", "/tmp/w.db", "--telemetry", "feed.json"
        });

        assertEquals(CliOptions.Mode.BOTH, options.mode());
        assertTrue(options.mode().includesObservations());
        assertTrue(options.mode().includesForecasts());
        assertEquals("EGLL", options.location());
        assertEquals(Path.of("/tmp/w.db"), options.database());

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> CliOptions.parse(new String[]{"--mode", "both", "--observations", "o.json"}));
        assertTrue(error.getMessage().contains("--forecasts"));
    }

    @Test
    void forecastModeDoesNotNeedObservations() {
        CliOptions options = CliOptions.parse(new String[]{"--mode", "forecast", "--forecasts", "f.json"});

        assertFalse(options.mode().includesObservations());
        assertNull(options.observations());
    }

    @Test
    void usageMistakesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"--mode", "hourly"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"--verbose", "yes"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"--observations"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"rows.json"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[0]));
    }

    @Test
    void helpShortCircuitsValidation() {
        assertTrue(CliOptions.parse(new String[]{"--help"}).help());
    }
}
