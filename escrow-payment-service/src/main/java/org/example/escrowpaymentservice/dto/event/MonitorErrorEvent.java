package org.example.escrowpaymentservice.dto.event;

public record MonitorErrorEvent(
        String blockchainIdentifier,
        Throwable cause
) implements PaymentEvent {
}
