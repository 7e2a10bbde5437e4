package org.example.escrowpaymentservice.dto;

import lombok.Builder;

import java.time.Instant;

/**
 * Parameters of a new payment request.
 *
 * @param identifierFromPurchaser buyer supplied identifier, also the hash salt
 * @param inputData               task input; hashed locally, never transmitted
 * @param payByTime               defaults to now + 12h
 * @param submitResultTime        defaults to now + 24h
 * @param metadata                free-form note stored by the ledger
 */
@Builder
public record CreatePaymentCommand(
        String identifierFromPurchaser,
        Object inputData,
        Instant payByTime,
        Instant submitResultTime,
        String metadata
) {
}
