package com.weatherledger.ingest.telemetry;

import com.weatherledger.core.model.TelemetryReading;
import com.weatherledger.ingest.support.FixtureUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelemetryFeedParserTest {
    @Test
    void parsesFeedAndSkipsMalformedEntries() {
        List<TelemetryReading> readings = TelemetryFeedParser.parse(FixtureUtils.fixtureText("fixtures/thames-feed.json"));

        assertEquals(3, readings.size());
        assertEquals(List.of(4320L, 4321L, 4323L), readings.stream().map(TelemetryReading::entryId).toList());

        TelemetryReading sparse = readings.get(1);
        assertEquals(Instant.parse("2025-11-15T01:48:00Z"), sparse.recordedAt());
        assertEquals(11.2, sparse.depth0p35mC());
        assertNull(sparse.depth2mC());
        assertNull(sparse.depth7mC());

        TelemetryReading numeric = readings.get(2);
        assertEquals(Instant.parse("2025-11-15T02:08:00Z"), numeric.recordedAt());
        assertEquals(11.4, numeric.depth0p35mC());
        assertEquals(10.8, numeric.depth7mC());
    }

    @Test
    void offsetTimestampsAreConvertedToUtc() {
        List<TelemetryReading> readings = TelemetryFeedParser.parse("""
                {"feeds":[{"created_at":"2025-07-01T13:48:00+01:00","entry_id":9,"field1":"18.5"}]}
                """);

        assertEquals(Instant.parse("2025-07-01T12:48:00Z"), readings.get(0).recordedAt());
    }

    @Test
    void fractionalEntryIdMarksTheEntryMalformed() {
        List<TelemetryReading> readings = TelemetryFeedParser.parse("""
                {"feeds":[
                  {"created_at":"2025-11-15T01:48:00Z","entry_id":4321.9,"field1":"11.2"},
                  {"created_at":"2025-11-15T02:03:00Z","entry_id":4322,"field1":"11.3"}
                ]}
                """);

        assertEquals(1, readings.size());
        assertEquals(4322L, readings.get(0).entryId());
    }

    @Test
    void missingFeedsArrayIsEmptyAndInvalidJsonIsRejected() {
        assertTrue(TelemetryFeedParser.parse("{\"channel\":{}}").isEmpty());
        assertTrue(TelemetryFeedParser.parse("{\"feeds\":[]}").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> TelemetryFeedParser.parse("{feeds:"));
    }
}
