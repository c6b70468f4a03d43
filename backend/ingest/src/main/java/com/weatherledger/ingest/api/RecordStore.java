package com.weatherledger.ingest.api;

import com.weatherledger.core.model.Forecast;
import com.weatherledger.core.model.Observation;
import com.weatherledger.core.model.RecordKind;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable, uniquely keyed storage for observations and forecasts.
 *
 * <p>An insert whose natural key already exists is a no-op reported as {@link InsertOutcome#SKIPPED}.
 * The uniqueness check and the write happen as one atomic statement, and a write is durable before
 * {@code insert} returns. Backend failures surface as {@link StoreUnavailableException}.
 */
public interface RecordStore {
    InsertOutcome insert(Observation observation);

    InsertOutcome insert(Forecast forecast);

    long count(RecordKind kind, Optional<String> location);

    Optional<Observation> findObservation(String location, Instant observedAt);

    /**
     * Every stored issue of the forecast for one hour, oldest scrape first.
     */
    List<Forecast> findForecasts(String location, Instant forecastAt);
}
