package org.example.escrowpaymentservice.dto;

import org.example.escrowpaymentservice.model.PaymentRequest;

import java.util.List;
import java.util.Optional;

public record PaymentPage(
        List<PaymentRequest> payments,
        String nextCursorId
) {

    public PaymentPage {
        payments = payments == null ? List.of() : List.copyOf(payments);
    }

    public Optional<String> findNextCursorId() {
        return Optional.ofNullable(nextCursorId);
    }
}
