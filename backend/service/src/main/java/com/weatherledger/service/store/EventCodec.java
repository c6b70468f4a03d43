package com.weatherledger.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weatherledger.core.events.Event;
import com.weatherledger.core.events.IngestRunCompleted;
import com.weatherledger.core.events.IngestRunStarted;
import com.weatherledger.core.events.RowDiscarded;
import com.weatherledger.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * One audit-log line per event: {@code {"type":..., "timestamp":..., "event":{...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "IngestRunStarted", IngestRunStarted.class,
            "RowDiscarded", RowDiscarded.class,
            "IngestRunCompleted", IngestRunCompleted.class
    );

    private EventCodec() {
    }

    public static Set<String> knownTypes() {
        return TYPES.keySet();
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        JsonNode node;
        try {
            node = MAPPER.readTree(line);
        } catch (IOException e) {
            throw new IllegalStateException("Audit line is not valid JSON", e);
        }
        String type = node.path("type").asText("");
        Class<? extends Event> eventClass = TYPES.get(type);
        if (eventClass == null) {
            throw new IllegalArgumentException("Unsupported event type: " + type);
        }
        try {
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to decode " + type, e);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
