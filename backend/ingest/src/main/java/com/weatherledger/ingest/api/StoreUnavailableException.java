package com.weatherledger.ingest.api;

/**
 * The persistence backend could not be reached, opened or written. Fatal for the current run.
 */
public class StoreUnavailableException extends IllegalStateException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
