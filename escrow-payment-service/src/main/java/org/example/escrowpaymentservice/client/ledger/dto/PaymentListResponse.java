package org.example.escrowpaymentservice.client.ledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.example.escrowpaymentservice.model.PaymentRequest;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PaymentListResponse(
        List<PaymentRequest> data,
        String nextCursorId
) {
}
