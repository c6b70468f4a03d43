package com.weatherledger.service;

import com.weatherledger.ingest.api.ReconcileSummary;
import com.weatherledger.ingest.api.StoreUnavailableException;
import com.weatherledger.service.config.ConfigLoader;
import com.weatherledger.service.config.IngestConfig;
import com.weatherledger.service.runtime.IngestRunner;
import com.weatherledger.service.runtime.RunReport;

import java.io.PrintStream;
import java.time.Clock;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_STORE_UNAVAILABLE = 1;
    static final int EXIT_USAGE = 2;

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, Clock.systemUTC()));
    }

    static int run(String[] args, PrintStream out, PrintStream err, Clock clock) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }
        if (options.help()) {
            out.println(CliOptions.USAGE);
            return EXIT_OK;
        }

        RunReport report;
        try {
            IngestConfig config = ConfigLoader.loadIngest(options.configDir());
            report = new IngestRunner(clock).run(options, config);
        } catch (StoreUnavailableException e) {
            LOGGER.log(Level.SEVERE, "Record store unavailable", e);
            err.println("Record store unavailable: " + e.getMessage());
            return EXIT_STORE_UNAVAILABLE;
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Ingest run failed", e);
            err.println(e.getMessage());
            return EXIT_USAGE;
        }
        print(report, out);
        return EXIT_OK;
    }

    static void print(RunReport report, PrintStream out) {
        out.println("Database: " + report.database());
        out.println("Total observations: " + report.totalObservations());
        out.println("Total forecasts: " + report.totalForecasts());
        for (ReconcileSummary summary : report.summaries()) {
            out.println("  " + summary.kind().name().toLowerCase(Locale.ROOT) + " " + summary.location()
                    + ": " + summary.inserted() + " new, " + summary.skipped() + " skipped, "
                    + summary.discarded() + " discarded");
        }
        out.println("Discarded: " + report.discarded());
        out.println("New: " + report.inserted());
        out.println("Skipped: " + report.skipped());
    }
}
