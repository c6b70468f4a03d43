package com.weatherledger.ingest.api;

public enum InsertOutcome {
    INSERTED,
    SKIPPED
}
