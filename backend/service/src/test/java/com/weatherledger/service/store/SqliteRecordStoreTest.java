package com.weatherledger.service.store;

import com.weatherledger.core.model.Forecast;
import com.weatherledger.core.model.Observation;
import com.weatherledger.core.model.RecordKind;
import com.weatherledger.ingest.api.InsertOutcome;
import com.weatherledger.ingest.api.StoreUnavailableException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteRecordStoreTest {
    private static final Instant OBSERVED = Instant.parse("2025-11-15T01:50:00Z");
    private static final Instant SCRAPED = Instant.parse("2025-11-15T02:05:00Z");

    @Test
    void secondInsertOfSameObservationKeyIsSkipped() throws Exception {
        Path db = Files.createTempDirectory("sqlite-store-dup-").resolve("weather.db");
        try (SqliteRecordStore store = SqliteRecordStore.open(db)) {
            assertEquals(InsertOutcome.INSERTED, store.insert(observation("EGLC", OBSERVED, 55.0)));
            // Same key, different values and scrape time: first write wins.
            Observation later = new Observation("EGLC", OBSERVED, SCRAPED.plusSeconds(3600),
                    60.0, null, null, null, null, null, null, null, null, null, null, null, null);
            assertEquals(InsertOutcome.SKIPPED, store.insert(later));

            assertEquals(1, store.count(RecordKind.OBSERVATION, Optional.empty()));
            assertEquals(55.0, store.findObservation("EGLC", OBSERVED).orElseThrow().temperatureF());
        }
    }

    @Test
    void sameInstantAtAnotherLocationIsADifferentRecord() throws Exception {
        Path db = Files.createTempDirectory("sqlite-store-location-").resolve("weather.db");
        try (SqliteRecordStore store = SqliteRecordStore.open(db)) {
            store.insert(observation("EGLC", OBSERVED, 55.0));
            store.insert(observation("EGLL", OBSERVED, 54.0));

            assertEquals(2, store.count(RecordKind.OBSERVATION, Optional.empty()));
            assertEquals(1, store.count(RecordKind.OBSERVATION, Optional.of("EGLL")));
            assertEquals(0, store.count(RecordKind.OBSERVATION, Optional.of("KJFK")));
            assertEquals(0, store.count(RecordKind.FORECAST, Optional.empty()));
        }
    }

    @Test
    void absentFieldsReadBackAsNullNotZero() throws Exception {
        Path db = Files.createTempDirectory("sqlite-store-null-").resolve("weather.db");
        try (SqliteRecordStore store = SqliteRecordStore.open(db)) {
            Observation sparse = new Observation("EGLC", OBSERVED, SCRAPED,
                    0.0, null, 0, null, null, null, null, null, null, null, null, null, null);
            store.insert(sparse);

            Observation stored = store.findObservation("EGLC", OBSERVED).orElseThrow();
            assertEquals(0.0, stored.temperatureF());
            assertEquals(0, stored.humidityPct());
            assertNull(stored.dewPointF());
            assertNull(stored.windSpeedMph());
            assertNull(stored.waterTempEntryId());
            assertEquals(sparse, stored);
        }
    }

    @Test
    void recordsSurviveReopen() throws Exception {
        Path db = Files.createTempDirectory("sqlite-store-reopen-").resolve("nested/dir/weather.db");
        Observation enriched = new Observation("EGLC", OBSERVED, SCRAPED,
                55.0, 50.0, 77, 12.0, null, null, 29.6, 0.0, "Cloudy", 11.2, 10.9, 10.7, 4321L);
        try (SqliteRecordStore store = SqliteRecordStore.open(db)) {
            store.insert(enriched);
        }
        try (SqliteRecordStore reopened = SqliteRecordStore.open(db)) {
            assertEquals(1, reopened.count(RecordKind.OBSERVATION, Optional.of("EGLC")));
            assertEquals(enriched, reopened.findObservation("EGLC", OBSERVED).orElseThrow());
            assertEquals(InsertOutcome.SKIPPED, reopened.insert(enriched));
        }
    }

    @Test
    void forecastsForOneHourAreKeptPerScrapeAndReturnedOldestFirst() throws Exception {
        Path db = Files.createTempDirectory("sqlite-store-forecast-").resolve("weather.db");
        Instant hour = Instant.parse("2025-11-16T00:00:00Z");
        Instant morning = Instant.parse("2025-11-15T08:00:00Z");
        Instant afternoon = Instant.parse("2025-11-15T14:05:30.500Z");
        Instant noon = Instant.parse("2025-11-15T12:00:00Z");
        try (SqliteRecordStore store = SqliteRecordStore.open(db)) {
            assertEquals(InsertOutcome.INSERTED, store.insert(forecast(hour, afternoon, 51.0)));
            assertEquals(InsertOutcome.INSERTED, store.insert(forecast(hour, morning, 49.0)));
            assertEquals(InsertOutcome.INSERTED, store.insert(forecast(hour, noon, 50.0)));
            assertEquals(InsertOutcome.SKIPPED, store.insert(forecast(hour, noon, 99.0)));

            List<Forecast> issues = store.findForecasts("EGLC", hour);
            assertEquals(3, issues.size());
            assertEquals(morning, issues.get(0).scrapedAt());
            assertEquals(noon, issues.get(1).scrapedAt());
            assertEquals(afternoon, issues.get(2).scrapedAt());
            assertEquals(50.0, issues.get(1).temperatureF());
            assertEquals(3, store.count(RecordKind.FORECAST, Optional.of("EGLC")));
        }
    }

    @Test
    void missingObservationIsEmpty() throws Exception {
        Path db = Files.createTempDirectory("sqlite-store-missing-").resolve("weather.db");
        try (SqliteRecordStore store = SqliteRecordStore.open(db)) {
            assertTrue(store.findObservation("EGLC", OBSERVED).isEmpty());
            assertTrue(store.findForecasts("EGLC", OBSERVED).isEmpty());
        }
    }

    @Test
    void fileThatIsNotADatabaseIsReportedAsUnavailable() throws Exception {
        Path db = Files.createTempDirectory("sqlite-store-corrupt-").resolve("weather.db");
        Files.writeString(db, "this is not a database file\n".repeat(200), StandardCharsets.UTF_8);

        StoreUnavailableException error = assertThrows(StoreUnavailableException.class, () -> SqliteRecordStore.open(db));
        assertTrue(error.getMessage().contains(db.toString()));
    }

    private static Observation observation(String location, Instant observedAt, double temperature) {
        return new Observation(location, observedAt, SCRAPED,
                temperature, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    private static Forecast forecast(Instant forecastAt, Instant scrapedAt, double temperature) {
        return new Forecast("EGLC", forecastAt, scrapedAt,
                temperature, null, null, null, null, null, null, null, null, null, null);
    }
}
