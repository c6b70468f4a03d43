package com.weatherledger.service;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Parsed command line. Optional flags that were not given are {@code null}.
 */
public record CliOptions(
        Mode mode,
        String location,
        Path database,
        Path configDir,
        Path observations,
        Path forecasts,
        Path telemetry,
        boolean help
) {
    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: weather-ledger [options]",
            "  --mode actual|forecast|both   which tables to ingest (default actual)",
            "  --location <code>             location code when the row batch names none",
            "  --db <path>                   SQLite database file",
            "  --config <dir>                directory holding ingest.json (default config)",
            "  --observations <rows.json>    observation row batch (modes actual, both)",
            "  --forecasts <rows.json>       forecast row batch (modes forecast, both)",
            "  --telemetry <feed.json>       read water temperature from a file instead of the feed URL",
            "  --help                        print this message");

    public enum Mode {
        ACTUAL,
        FORECAST,
        BOTH;

        public boolean includesObservations() {
            return this != FORECAST;
        }

        public boolean includesForecasts() {
            return this != ACTUAL;
        }

        static Mode fromText(String text) {
            try {
                return Mode.valueOf(text.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown mode: " + text, e);
            }
        }
    }

    /**
     * @throws IllegalArgumentException for unknown flags, missing values, a bad mode, or a mode whose
     *                                  row batch was not supplied
     */
    public static CliOptions parse(String[] args) {
        Mode mode = Mode.ACTUAL;
        String location = null;
        Path database = null;
        Path configDir = Path.of("config");
        Path observations = null;
        Path forecasts = null;
        Path telemetry = null;

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            if ("--help".equals(flag) || "-h".equals(flag)) {
                return new CliOptions(mode, location, database, configDir, observations, forecasts, telemetry, true);
            }
            if (!flag.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + flag);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String value = args[++i];
            switch (flag) {
                case "--mode" -> mode = Mode.fromText(value);
                case "--location" -> location = value.trim();
                case "--db" -> database = Path.of(value);
                case "--config" -> configDir = Path.of(value);
                case "--observations" -> observations = Path.of(value);
                case "--forecasts" -> forecasts = Path.of(value);
                case "--telemetry" -> telemetry = Path.of(value);
                default -> throw new IllegalArgumentException("Unknown option: " + flag);
            }
        }

        if (mode.includesObservations() && observations == null) {
            throw new IllegalArgumentException("--observations is required for mode " + name(mode));
        }
        if (mode.includesForecasts() && forecasts == null) {
            throw new IllegalArgumentException("--forecasts is required for mode " + name(mode));
        }
        return new CliOptions(mode, location, database, configDir, observations, forecasts, telemetry, false);
    }

    private static String name(Mode mode) {
        return mode.name().toLowerCase(Locale.ROOT);
    }
}
