package org.example.escrowpaymentservice.dto.event;

/**
 * Notification emitted by the payment lifecycle engine.
 */
public interface PaymentEvent {

    String blockchainIdentifier();

}
