package com.weatherledger.core.bus;

import com.weatherledger.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process event bus. Handlers run on the publishing thread; a handler that throws is
 * reported to the error callback and the remaining handlers still run.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<? super Event>>> subscribers = new ConcurrentHashMap<>();
    private final List<Consumer<? super Event>> wildcardSubscribers = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for type " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        subscribers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>())
                .add(event -> handler.accept(type.cast(event)));
    }

    /**
     * Receives every published event regardless of its type, after the typed subscribers.
     */
    public void subscribeAll(Consumer<Event> handler) {
        wildcardSubscribers.add(handler::accept);
    }

    public void publish(Event event) {
        for (Consumer<? super Event> handler : subscribers.getOrDefault(event.getClass(), List.of())) {
            invoke(handler, event);
        }
        for (Consumer<? super Event> handler : wildcardSubscribers) {
            invoke(handler, event);
        }
    }

    private void invoke(Consumer<? super Event> handler, Event event) {
        try {
            handler.accept(event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}
