package com.weatherledger.ingest.api;

import com.weatherledger.core.model.RecordKind;

/**
 * Counts for one reconciliation pass. Discarded rows had an unparseable time and were never offered
 * to the store, so they are counted as neither inserted nor skipped.
 */
public record ReconcileSummary(RecordKind kind, String location, int discarded, int inserted, int skipped) {
    public int total() {
        return discarded + inserted + skipped;
    }
}
