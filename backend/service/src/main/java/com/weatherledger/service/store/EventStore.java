package com.weatherledger.service.store;

import com.weatherledger.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EventStore {
    void append(Event event);

    /**
     * The most recent {@code limit} events at or after {@code since}, oldest first.
     */
    List<Event> query(Instant since, Optional<String> type, int limit);
}
