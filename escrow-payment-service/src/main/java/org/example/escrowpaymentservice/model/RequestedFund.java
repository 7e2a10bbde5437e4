package org.example.escrowpaymentservice.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestedFund(
        String amount,
        String unit
) {
}
