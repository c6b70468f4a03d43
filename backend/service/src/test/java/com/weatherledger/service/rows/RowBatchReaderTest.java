package com.weatherledger.service.rows;

import com.weatherledger.ingest.rows.RowBatch;
import com.weatherledger.service.support.FixtureUtils;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RowBatchReaderTest {
    @Test
    void readsAFullyDescribedBatch() throws Exception {
        Path file = FixtureUtils.copyFixture("fixtures/observations.json", Files.createTempDirectory("rows-full-"));

        RowBatch batch = RowBatchReader.read(file);

        assertEquals("EGLC", batch.location());
        assertEquals(LocalDate.of(2025, 11, 15), batch.referenceDate());
        assertEquals(Instant.parse("2025-11-15T02:05:00Z"), batch.scrapedAt());
        assertEquals(3, batch.rows().size());
        assertEquals("1:50 AM", batch.rows().get(1).get(0));
        assertEquals("", batch.rows().get(1).get(4));
    }

    @Test
    void omittedFieldsAreFilledWhenResolved() throws Exception {
        Path file = FixtureUtils.copyFixture("fixtures/forecasts.json", Files.createTempDirectory("rows-partial-"));
        Clock clock = Clock.fixed(Instant.parse("2025-11-15T23:30:00Z"), ZoneOffset.UTC);

        RowBatch raw = RowBatchReader.read(file);
        assertNull(raw.location());
        assertNull(raw.referenceDate());

        RowBatch resolved = raw.resolve("EGLC", ZoneId.of("Europe/London"), clock);
        assertEquals("EGLC", resolved.location());
        assertEquals(Instant.parse("2025-11-15T14:05:00Z"), resolved.scrapedAt());
        assertEquals(LocalDate.of(2025, 11, 15), resolved.referenceDate());
    }

    @Test
    void batchWithoutRowsIsEmpty() throws Exception {
        Path file = Files.createTempDirectory("rows-empty-").resolve("rows.json");
        Files.writeString(file, "{\"location\":\"EGLC\"}", StandardCharsets.UTF_8);

        assertEquals(List.of(), RowBatchReader.read(file).rows());
    }

    @Test
    void missingOrBrokenFilesAreRejected() throws Exception {
        Path dir = Files.createTempDirectory("rows-bad-");
        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "[[\"1:50 AM\"", StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class, () -> RowBatchReader.read(dir.resolve("absent.json")));
        assertThrows(IllegalStateException.class, () -> RowBatchReader.read(broken));
    }
}
