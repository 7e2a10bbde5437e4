package org.example.escrowpaymentservice.dto.event;

import org.example.escrowpaymentservice.model.PaymentRequest;

public record PaymentCreatedEvent(
        PaymentRequest payment
) implements PaymentEvent {

    @Override
    public String blockchainIdentifier() {
        return payment.getBlockchainIdentifier();
    }
}
