package com.weatherledger.ingest.api;

import com.weatherledger.core.bus.EventBus;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Collaborators shared by one ingestion run. The store is opened by the caller and handed in here.
 */
public record IngestContext(
        EventBus eventBus,
        RecordStore recordStore,
        Clock clock,
        ZoneId zone
) {
    public IngestContext {
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(recordStore, "recordStore is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(zone, "zone is required");
    }
}
