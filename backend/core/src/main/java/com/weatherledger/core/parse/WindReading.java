package com.weatherledger.core.parse;

/**
 * Wind parsed from a combined {@code "speed unit direction"} token. Any field may be {@code null}.
 */
public record WindReading(Double speedMph, String direction, Double gustMph) {
    public static final WindReading ABSENT = new WindReading(null, null, null);

    public boolean isAbsent() {
        return speedMph == null && direction == null && gustMph == null;
    }
}
