package com.weatherledger.core.parse;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the loosely formatted cell text of an hourly weather table into numbers.
 *
 * <p>Every method is total: malformed, blank or {@code null} input yields an empty result, never an exception.
 * Numbers are plain decimals only; exponents, hex, {@code NaN} and {@code Infinity} are rejected.
 */
public final class UnitParser {
    private static final String NUMBER = "[-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)";
    private static final Pattern NUMBER_ONLY = Pattern.compile(NUMBER);
    private static final Pattern TEMPERATURE = Pattern.compile(
            "(" + NUMBER + ")\\s*(?:°\\s*[FC]?|[FC])?",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern PERCENTAGE = Pattern.compile("([-+]?\\d+)\\s*%?");
    private static final Pattern INCHES = Pattern.compile("(" + NUMBER + ")\\s*(?:in)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String WIND_UNIT = "mph";

    private UnitParser() {
    }

    /**
     * {@code "55 °F"}, {@code "55°"}, {@code "55F"} and {@code "55"} all parse to {@code 55.0}.
     */
    public static OptionalDouble temperature(String raw) {
        return matchDecimal(TEMPERATURE, raw);
    }

    /**
     * {@code "77 %"} parses to {@code 77}; fractional percentages are rejected.
     */
    public static OptionalInt percentage(String raw) {
        String text = clean(raw);
        if (text.isEmpty()) {
            return OptionalInt.empty();
        }
        Matcher matcher = PERCENTAGE.matcher(text);
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException overflow) {
            return OptionalInt.empty();
        }
    }

    /**
     * Pressure and precipitation: {@code "29.60 in"} parses to {@code 29.6}.
     */
    public static OptionalDouble inches(String raw) {
        return matchDecimal(INCHES, raw);
    }

    /**
     * Splits {@code "12 mph E"} into speed {@code 12.0} and direction {@code "E"}. The last token is the
     * direction unless it is the unit itself. Gust never appears in this form and is always absent.
     */
    public static WindReading wind(String raw) {
        String text = clean(raw);
        if (text.isEmpty()) {
            return WindReading.ABSENT;
        }
        String[] tokens = WHITESPACE.split(text);
        OptionalDouble speed = number(tokens[0]);
        if (speed.isEmpty()) {
            return WindReading.ABSENT;
        }
        String direction = null;
        if (tokens.length > 1) {
            String last = tokens[tokens.length - 1];
            if (!WIND_UNIT.equals(last.toLowerCase(Locale.ROOT))) {
                direction = last;
            }
        }
        return new WindReading(speed.getAsDouble(), direction, null);
    }

    /**
     * Trimmed cell text, or {@code null} when the cell is blank.
     */
    public static String text(String raw) {
        String text = clean(raw);
        return text.isEmpty() ? null : text;
    }

    /**
     * A bare decimal with no unit, as sent by the telemetry feed.
     */
    public static OptionalDouble decimal(String raw) {
        return number(clean(raw));
    }

    private static OptionalDouble matchDecimal(Pattern pattern, String raw) {
        String text = clean(raw);
        if (text.isEmpty()) {
            return OptionalDouble.empty();
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.matches()) {
            return OptionalDouble.empty();
        }
        return number(matcher.group(1));
    }

    private static OptionalDouble number(String token) {
        if (!NUMBER_ONLY.matcher(token).matches()) {
            return OptionalDouble.empty();
        }
        double value = Double.parseDouble(token);
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    // Scraped cells carry non-breaking spaces that String.trim() leaves in place.
    private static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replace('\u00A0', ' ').trim();
    }
}
