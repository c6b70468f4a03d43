package com.weatherledger.ingest.rows;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Raw table rows as handed over by the row source, one list of cell texts per row.
 *
 * <p>{@code location}, {@code referenceDate} and {@code scrapedAt} may be left out by the source;
 * {@link #resolve} fills them in before reconciliation.
 */
public record RowBatch(
        String location,
        LocalDate referenceDate,
        Instant scrapedAt,
        List<List<String>> rows
) {
    public RowBatch {
        rows = rows == null ? List.of() : rows;
    }

    public RowBatch resolve(String defaultLocation, ZoneId zone, Clock clock) {
        String resolvedLocation = location == null || location.isBlank() ? defaultLocation : location;
        Instant resolvedScrapedAt = scrapedAt == null ? clock.instant() : scrapedAt;
        LocalDate resolvedDate = referenceDate == null
                ? resolvedScrapedAt.atZone(zone).toLocalDate()
                : referenceDate;
        return new RowBatch(resolvedLocation, resolvedDate, resolvedScrapedAt, rows);
    }
}
