package org.example.escrowpaymentservice.core.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous listener registry. Events reach every listener registered at publish time, in
 * publish order; a failing listener does not stop delivery to the others.
 */
@Slf4j
public class EventDispatcher<E> {

    private final String name;
    private final List<DomainEventListener<? super E>> listeners = new CopyOnWriteArrayList<>();

    public EventDispatcher(String name) {
        this.name = name;
    }

    public void subscribe(DomainEventListener<? super E> listener) {
        listeners.add(listener);
    }

    public boolean unsubscribe(DomainEventListener<? super E> listener) {
        return listeners.remove(listener);
    }

    public void publish(E event) {
        for (DomainEventListener<? super E> listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("{} listener {} failed on {}", name, listener, event.getClass().getSimpleName(), e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void clear() {
        listeners.clear();
    }
}
