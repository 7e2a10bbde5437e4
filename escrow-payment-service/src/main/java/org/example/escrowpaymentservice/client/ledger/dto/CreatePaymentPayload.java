package org.example.escrowpaymentservice.client.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.example.escrowpaymentservice.model.Network;

/**
 * Body of {@code POST /payment}. Only the input hash is sent, never the input itself.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreatePaymentPayload(
        String agentIdentifier,
        Network network,
        String paymentType,
        String payByTime,
        String submitResultTime,
        String identifierFromPurchaser,
        String inputHash,
        String metadata
) {
}
