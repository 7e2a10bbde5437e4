package org.example.escrowpaymentservice.dto.event;

import org.example.escrowpaymentservice.model.PaymentRequest;

public record PaymentCompletedEvent(
        PaymentRequest payment
) implements PaymentEvent {

    @Override
    public String blockchainIdentifier() {
        return payment.getBlockchainIdentifier();
    }
}
