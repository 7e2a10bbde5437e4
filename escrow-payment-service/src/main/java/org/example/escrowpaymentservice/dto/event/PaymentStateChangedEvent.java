package org.example.escrowpaymentservice.dto.event;

import org.example.escrowpaymentservice.model.PaymentRequest;
import org.example.escrowpaymentservice.model.PaymentState;

/**
 * A refresh observed a different on-chain state. {@code previousState} is null the first
 * time a state is observed.
 */
public record PaymentStateChangedEvent(
        String blockchainIdentifier,
        PaymentState previousState,
        PaymentState newState,
        PaymentRequest payment
) implements PaymentEvent {
}
