package org.example.escrowpaymentservice.dto.event;

public record ResultSubmittedEvent(
        String blockchainIdentifier,
        String resultHash
) implements PaymentEvent {
}
