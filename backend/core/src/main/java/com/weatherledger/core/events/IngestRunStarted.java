package com.weatherledger.core.events;

import com.weatherledger.core.model.RecordKind;

import java.time.Instant;

public record IngestRunStarted(
        Instant timestamp,
        RecordKind kind,
        String location,
        int rowCount
) implements Event {
    @Override
    public String type() {
        return "IngestRunStarted";
    }
}
