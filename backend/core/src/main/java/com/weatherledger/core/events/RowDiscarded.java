package com.weatherledger.core.events;

import com.weatherledger.core.model.RecordKind;

import java.time.Instant;

public record RowDiscarded(
        Instant timestamp,
        RecordKind kind,
        String location,
        int rowIndex,
        String timeText
) implements Event {
    @Override
    public String type() {
        return "RowDiscarded";
    }
}
