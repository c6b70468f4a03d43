package com.weatherledger.core.model;

public enum RecordKind {
    OBSERVATION,
    FORECAST
}
