package org.example.escrowpaymentservice.client.ledger.dto;

import org.example.escrowpaymentservice.model.Network;

public record ListPaymentsQuery(
        Network network,
        int limit,
        String cursorId,
        String filterSmartContractAddress
) {
}
