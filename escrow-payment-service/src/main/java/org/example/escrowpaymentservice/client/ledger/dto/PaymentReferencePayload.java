package org.example.escrowpaymentservice.client.ledger.dto;

import org.example.escrowpaymentservice.model.Network;

public record PaymentReferencePayload(
        String blockchainIdentifier,
        Network network
) {
}
