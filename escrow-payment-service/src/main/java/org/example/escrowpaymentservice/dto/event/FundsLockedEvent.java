package org.example.escrowpaymentservice.dto.event;

import org.example.escrowpaymentservice.model.PaymentRequest;

//Buyer funds are in escrow, work may begin
public record FundsLockedEvent(
        PaymentRequest payment
) implements PaymentEvent {

    @Override
    public String blockchainIdentifier() {
        return payment.getBlockchainIdentifier();
    }
}
