package org.example.escrowpaymentservice.dto.event;

public record RefundAuthorizedEvent(
        String blockchainIdentifier
) implements PaymentEvent {
}
