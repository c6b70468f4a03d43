package com.weatherledger.core.events;

import com.weatherledger.core.model.RecordKind;

import java.time.Instant;

public record IngestRunCompleted(
        Instant timestamp,
        RecordKind kind,
        String location,
        int discarded,
        int inserted,
        int skipped,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "IngestRunCompleted";
    }
}
