package org.example.escrowpaymentservice.core.event;

import org.example.escrowpaymentservice.dto.event.PaymentEvent;

/**
 * Receives payment lifecycle events. Spring beans implementing this interface are subscribed
 * automatically when the engine starts.
 */
@FunctionalInterface
public interface PaymentEventListener extends DomainEventListener<PaymentEvent> {
}
