package org.example.escrowpaymentservice.core.event;

@FunctionalInterface
public interface DomainEventListener<E> {

    void onEvent(E event);

}
