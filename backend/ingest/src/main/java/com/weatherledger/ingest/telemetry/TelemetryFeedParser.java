package com.weatherledger.ingest.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import com.weatherledger.core.model.TelemetryReading;
import com.weatherledger.core.parse.UnitParser;
import com.weatherledger.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.logging.Logger;

/**
 * Reads the water-temperature channel feed: {@code {"feeds":[{"created_at", "entry_id", "field1".."field3"}]}}.
 * Fields 1 to 3 are the 0.35 m, 2 m and 7 m depths.
 */
public final class TelemetryFeedParser {
    private static final Logger LOGGER = Logger.getLogger(TelemetryFeedParser.class.getName());

    private TelemetryFeedParser() {
    }

    public static List<TelemetryReading> parse(String json) {
        try {
            return parse(JsonUtils.objectMapper().readTree(json));
        } catch (IOException e) {
            throw new IllegalArgumentException("Telemetry feed is not valid JSON", e);
        }
    }

    public static List<TelemetryReading> parse(JsonNode root) {
        JsonNode feeds = root == null ? null : root.path("feeds");
        if (feeds == null || !feeds.isArray()) {
            return List.of();
        }
        List<TelemetryReading> readings = new ArrayList<>();
        for (JsonNode entry : feeds) {
            try {
                readings.add(toReading(entry));
            } catch (IllegalArgumentException | DateTimeParseException malformed) {
                LOGGER.warning("Skipping malformed telemetry entry " + entry + ": " + malformed.getMessage());
            }
        }
        return readings;
    }

    static TelemetryReading toReading(JsonNode entry) {
        String createdAt = entry.path("created_at").asText("");
        if (createdAt.isBlank()) {
            throw new IllegalArgumentException("missing created_at");
        }
        Instant recordedAt = ZonedDateTime.parse(createdAt.trim()).toInstant();
        return new TelemetryReading(
                recordedAt,
                depth(entry, "field1"),
                depth(entry, "field2"),
                depth(entry, "field3"),
                entryId(entry)
        );
    }

    private static Double depth(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        String text = node.asText("");
        if (text.isBlank()) {
            return null;
        }
        OptionalDouble value = UnitParser.decimal(text);
        if (value.isEmpty()) {
            throw new IllegalArgumentException(field + " is not numeric: " + text);
        }
        return value.getAsDouble();
    }

    private static Long entryId(JsonNode entry) {
        JsonNode node = entry.get("entry_id");
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            if (!node.isIntegralNumber() || !node.canConvertToLong()) {
                throw new IllegalArgumentException("entry_id is not an integer: " + node);
            }
            return node.longValue();
        }
        String text = node.asText("").trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("entry_id is not an integer: " + text, e);
        }
    }
}
