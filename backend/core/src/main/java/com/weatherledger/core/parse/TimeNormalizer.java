package com.weatherledger.core.parse;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a 12-hour wall-clock string such as {@code "1:50 AM"} or {@code "1 :50 am"} into a UTC instant.
 *
 * <p>The local date-time is resolved in the given zone. A time that falls in a spring-forward gap is
 * pushed forward by the length of the gap; a time repeated by a fall-back overlap resolves to the later
 * (standard time) offset.
 */
public final class TimeNormalizer {
    private static final Pattern CLOCK = Pattern.compile(
            "(\\d{1,2})\\s*:\\s*(\\d{2})\\s*([AP])\\.?\\s*M\\.?",
            Pattern.CASE_INSENSITIVE
    );

    private TimeNormalizer() {
    }

    public static Optional<Instant> normalize(
            String localTimeText,
            LocalDate referenceDate,
            ZoneId zone,
            RolloverPolicy rolloverPolicy
    ) {
        if (referenceDate == null || zone == null) {
            return Optional.empty();
        }
        RolloverPolicy policy = rolloverPolicy == null ? RolloverPolicy.none() : rolloverPolicy;
        return parseClockTime(localTimeText).map(time -> {
            ZonedDateTime local = localize(referenceDate, time, zone);
            if (policy.rollsOver(local)) {
                local = localize(referenceDate.plusDays(1), time, zone);
            }
            return local.toInstant();
        });
    }

    public static Optional<LocalTime> parseClockTime(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = CLOCK.matcher(text.replace('\u00A0', ' ').trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour < 1 || hour > 12 || minute > 59) {
            return Optional.empty();
        }
        boolean pm = Character.toUpperCase(matcher.group(3).charAt(0)) == 'P';
        int hourOfDay = hour % 12 + (pm ? 12 : 0);
        return Optional.of(LocalTime.of(hourOfDay, minute));
    }

    private static ZonedDateTime localize(LocalDate date, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(LocalDateTime.of(date, time), zone).withLaterOffsetAtOverlap();
    }
}
