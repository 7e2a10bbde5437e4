package org.example.escrowpaymentservice.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NextAction(
        String requestedAction,
        String errorType,
        String errorNote
) {
}
