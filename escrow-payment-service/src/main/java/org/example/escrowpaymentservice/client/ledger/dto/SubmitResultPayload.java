package org.example.escrowpaymentservice.client.ledger.dto;

import org.example.escrowpaymentservice.model.Network;

public record SubmitResultPayload(
        String blockchainIdentifier,
        Network network,
        String resultHash
) {
}
