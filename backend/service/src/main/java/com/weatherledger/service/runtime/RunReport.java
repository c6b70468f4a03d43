package com.weatherledger.service.runtime;

import com.weatherledger.ingest.api.ReconcileSummary;

import java.nio.file.Path;
import java.util.List;

public record RunReport(
        Path database,
        long totalObservations,
        long totalForecasts,
        List<ReconcileSummary> summaries
) {
    public RunReport {
        summaries = List.copyOf(summaries);
    }

    public int discarded() {
        return summaries.stream().mapToInt(ReconcileSummary::discarded).sum();
    }

    public int inserted() {
        return summaries.stream().mapToInt(ReconcileSummary::inserted).sum();
    }

    public int skipped() {
        return summaries.stream().mapToInt(ReconcileSummary::skipped).sum();
    }
}
