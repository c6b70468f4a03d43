package com.weatherledger.ingest.reconcile;

import com.weatherledger.core.events.IngestRunCompleted;
import com.weatherledger.core.events.IngestRunStarted;
import com.weatherledger.core.events.RowDiscarded;
import com.weatherledger.core.model.Forecast;
import com.weatherledger.core.model.Observation;
import com.weatherledger.core.model.RecordKind;
import com.weatherledger.core.model.TelemetryReading;
import com.weatherledger.core.parse.RolloverPolicy;
import com.weatherledger.core.parse.TimeNormalizer;
import com.weatherledger.ingest.api.IngestContext;
import com.weatherledger.ingest.api.InsertOutcome;
import com.weatherledger.ingest.api.ReconcileSummary;
import com.weatherledger.ingest.rows.ForecastRowMapper;
import com.weatherledger.ingest.rows.ObservationRowMapper;
import com.weatherledger.ingest.rows.RowBatch;
import com.weatherledger.ingest.telemetry.TelemetryMatcher;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Normalizes raw table rows into observations and forecasts, attaches the nearest telemetry reading to
 * each observation, and offers every record to the store.
 *
 * <p>A row whose time cannot be parsed is dropped and counted as discarded. Store failures are not caught
 * here: they end the pass and reach the caller.
 */
public class ReconciliationOrchestrator {
    public static final int DEFAULT_FORECAST_HOURS = 24;

    private static final Logger LOGGER = Logger.getLogger(ReconciliationOrchestrator.class.getName());

    private final IngestContext ctx;
    private final int forecastHours;

    public ReconciliationOrchestrator(IngestContext ctx) {
        this(ctx, DEFAULT_FORECAST_HOURS);
    }

    public ReconciliationOrchestrator(IngestContext ctx, int forecastHours) {
        if (forecastHours < 1) {
            throw new IllegalArgumentException("forecastHours must be positive: " + forecastHours);
        }
        this.ctx = ctx;
        this.forecastHours = forecastHours;
    }

    public ReconcileSummary reconcileObservations(
            List<List<String>> rawRows,
            List<TelemetryReading> telemetry,
            String location,
            Instant scrapedAt
    ) {
        LocalDate scrapeDate = scrapedAt.atZone(ctx.zone()).toLocalDate();
        return reconcileObservations(rawRows, telemetry, location, scrapeDate, scrapedAt);
    }

    public ReconcileSummary reconcileObservations(RowBatch batch, List<TelemetryReading> telemetry) {
        return reconcileObservations(batch.rows(), telemetry, batch.location(), batch.referenceDate(), batch.scrapedAt());
    }

    public ReconcileSummary reconcileObservations(
            List<List<String>> rawRows,
            List<TelemetryReading> telemetry,
            String location,
            LocalDate referenceDate,
            Instant scrapedAt
    ) {
        Tally tally = start(RecordKind.OBSERVATION, location, rawRows.size());
        List<TelemetryReading> readings = telemetry == null ? List.of() : telemetry;
        for (int i = 0; i < rawRows.size(); i++) {
            List<String> row = rawRows.get(i);
            String timeText = ObservationRowMapper.timeText(row);
            Optional<Instant> observedAt = TimeNormalizer.normalize(timeText, referenceDate, ctx.zone(), RolloverPolicy.none());
            if (observedAt.isEmpty()) {
                tally.discard(i, timeText);
                continue;
            }
            Observation observation = ObservationRowMapper.map(row, location, observedAt.get(), scrapedAt)
                    .withTelemetry(TelemetryMatcher.closest(observedAt.get(), readings).orElse(null));
            tally.record(ctx.recordStore().insert(observation), observedAt.get());
        }
        return tally.complete();
    }

    public ReconcileSummary reconcileForecasts(List<List<String>> rawRows, String location, Instant scrapedAt) {
        LocalDate scrapeDate = scrapedAt.atZone(ctx.zone()).toLocalDate();
        return reconcileForecasts(rawRows, location, scrapeDate, scrapedAt);
    }

    /**
     * Hours are dated on {@code referenceDate}; an hour not after {@code scrapedAt} moves to the following day.
     */
    public ReconcileSummary reconcileForecasts(
            List<List<String>> rawRows,
            String location,
            LocalDate referenceDate,
            Instant scrapedAt
    ) {
        RolloverPolicy rollover = RolloverPolicy.nextDayUnlessAfter(scrapedAt);
        List<List<String>> rows = rawRows.size() > forecastHours ? rawRows.subList(0, forecastHours) : rawRows;

        Tally tally = start(RecordKind.FORECAST, location, rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            String hourText = ForecastRowMapper.hourText(row);
            Optional<Instant> forecastAt = TimeNormalizer.normalize(hourText, referenceDate, ctx.zone(), rollover);
            if (forecastAt.isEmpty()) {
                tally.discard(i, hourText);
                continue;
            }
            Forecast forecast = ForecastRowMapper.map(row, location, forecastAt.get(), scrapedAt);
            tally.record(ctx.recordStore().insert(forecast), forecastAt.get());
        }
        return tally.complete();
    }

    public ReconcileSummary reconcileForecasts(RowBatch batch) {
        return reconcileForecasts(batch.rows(), batch.location(), batch.referenceDate(), batch.scrapedAt());
    }

    private Tally start(RecordKind kind, String location, int rowCount) {
        Instant startedAt = ctx.clock().instant();
        ctx.eventBus().publish(new IngestRunStarted(startedAt, kind, location, rowCount));
        LOGGER.info("Reconciling " + rowCount + " " + kind.name().toLowerCase(Locale.ROOT)
                + " rows for " + location);
        return new Tally(kind, location, startedAt);
    }

    private final class Tally {
        private final RecordKind kind;
        private final String location;
        private final Instant startedAt;
        private int discarded;
        private int inserted;
        private int skipped;

        private Tally(RecordKind kind, String location, Instant startedAt) {
            this.kind = kind;
            this.location = location;
            this.startedAt = startedAt;
        }

        void discard(int rowIndex, String timeText) {
            discarded++;
            LOGGER.warning("Discarding " + kind + " row " + rowIndex + " with unparseable time: '" + timeText + "'");
            ctx.eventBus().publish(new RowDiscarded(ctx.clock().instant(), kind, location, rowIndex, timeText));
        }

        void record(InsertOutcome outcome, Instant key) {
            if (outcome == InsertOutcome.INSERTED) {
                inserted++;
            } else {
                skipped++;
                LOGGER.fine(() -> "Duplicate " + kind + " for " + location + " at " + key + " skipped");
            }
        }

        ReconcileSummary complete() {
            Instant finishedAt = ctx.clock().instant();
            long durationMillis = Duration.between(startedAt, finishedAt).toMillis();
            ctx.eventBus().publish(new IngestRunCompleted(
                    finishedAt,
                    kind,
                    location,
                    discarded,
                    inserted,
                    skipped,
                    durationMillis
            ));
            LOGGER.info(kind + " " + location + ": discarded=" + discarded + " inserted=" + inserted
                    + " skipped=" + skipped);
            return new ReconcileSummary(kind, location, discarded, inserted, skipped);
        }
    }
}
