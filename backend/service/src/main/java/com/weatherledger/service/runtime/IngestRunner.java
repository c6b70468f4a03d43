package com.weatherledger.service.runtime;

import com.weatherledger.core.bus.EventBus;
import com.weatherledger.core.model.RecordKind;
import com.weatherledger.core.model.TelemetryReading;
import com.weatherledger.ingest.api.IngestContext;
import com.weatherledger.ingest.api.ReconcileSummary;
import com.weatherledger.ingest.reconcile.ReconciliationOrchestrator;
import com.weatherledger.ingest.rows.RowBatch;
import com.weatherledger.ingest.telemetry.TelemetrySource;
import com.weatherledger.service.CliOptions;
import com.weatherledger.service.config.IngestConfig;
import com.weatherledger.service.config.TelemetryConfig;
import com.weatherledger.service.rows.RowBatchReader;
import com.weatherledger.service.store.JsonlEventStore;
import com.weatherledger.service.store.SqliteRecordStore;
import com.weatherledger.service.telemetry.FileTelemetrySource;
import com.weatherledger.service.telemetry.ThingSpeakTelemetrySource;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * One ingestion run: read the row batches, open the store, reconcile each requested table and report totals.
 */
public final class IngestRunner {
    private static final Logger LOGGER = Logger.getLogger(IngestRunner.class.getName());

    private final Clock clock;
    private final Supplier<HttpClient> httpClient;

    public IngestRunner(Clock clock) {
        this(clock, null);
    }

    public IngestRunner(Clock clock, HttpClient httpClient) {
        this.clock = clock;
        this.httpClient = httpClient == null ? IngestRunner::defaultHttpClient : () -> httpClient;
    }

    public RunReport run(CliOptions options, IngestConfig config) {
        String location = options.location() == null || options.location().isBlank()
                ? config.location()
                : options.location();
        ZoneId zone = config.zone();
        Path database = options.database() == null ? config.database() : options.database();

        RowBatch observations = options.mode().includesObservations()
                ? RowBatchReader.read(options.observations()).resolve(location, zone, clock)
                : null;
        RowBatch forecasts = options.mode().includesForecasts()
                ? RowBatchReader.read(options.forecasts()).resolve(location, zone, clock)
                : null;
        TelemetrySource telemetrySource = telemetrySource(options, config.telemetry());

        EventBus eventBus = new EventBus();
        JsonlEventStore auditLog = new JsonlEventStore(config.eventLog());
        eventBus.subscribeAll(auditLog::append);

        List<ReconcileSummary> summaries = new ArrayList<>();
        try (SqliteRecordStore store = SqliteRecordStore.open(database)) {
            IngestContext ctx = new IngestContext(eventBus, store, clock, zone);
            ReconciliationOrchestrator orchestrator = new ReconciliationOrchestrator(ctx, config.forecastHours());
            if (observations != null) {
                List<TelemetryReading> telemetry = observations.rows().isEmpty()
                        ? List.of()
                        : telemetrySource.fetchReadings();
                summaries.add(orchestrator.reconcileObservations(observations, telemetry));
            }
            if (forecasts != null) {
                summaries.add(orchestrator.reconcileForecasts(forecasts));
            }
            RunReport report = new RunReport(
                    database,
                    store.count(RecordKind.OBSERVATION, Optional.empty()),
                    store.count(RecordKind.FORECAST, Optional.empty()),
                    summaries
            );
            LOGGER.info("Run finished for " + database + ": " + report.inserted() + " new, "
                    + report.skipped() + " skipped, " + report.discarded() + " discarded");
            return report;
        }
    }

    private TelemetrySource telemetrySource(CliOptions options, TelemetryConfig telemetry) {
        if (options.telemetry() != null) {
            return new FileTelemetrySource(options.telemetry());
        }
        return new ThingSpeakTelemetrySource(httpClient.get(), telemetry.url(), telemetry.results(), telemetry.timeout());
    }

    private static HttpClient defaultHttpClient() {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
