package com.weatherledger.core.parse;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Decides whether a parsed clock time belongs to the day after the reference date.
 *
 * <p>Hourly forecast listings start at the next hour and wrap past midnight, so an hour that is not
 * strictly after the moment of scraping refers to tomorrow. Observations never roll over.
 */
public final class RolloverPolicy {
    private static final RolloverPolicy NONE = new RolloverPolicy(null);

    private final Instant current;

    private RolloverPolicy(Instant current) {
        this.current = current;
    }

    public static RolloverPolicy none() {
        return NONE;
    }

    public static RolloverPolicy nextDayUnlessAfter(Instant current) {
        return new RolloverPolicy(Objects.requireNonNull(current, "current is required"));
    }

    public static RolloverPolicy nextDayUnlessAfter(ZonedDateTime currentLocal) {
        return nextDayUnlessAfter(currentLocal.toInstant());
    }

    boolean rollsOver(ZonedDateTime candidate) {
        return current != null && !candidate.toInstant().isAfter(current);
    }

    @Override
    public String toString() {
        return current == null ? "RolloverPolicy[none]" : "RolloverPolicy[nextDayUnlessAfter=" + current + "]";
    }
}
