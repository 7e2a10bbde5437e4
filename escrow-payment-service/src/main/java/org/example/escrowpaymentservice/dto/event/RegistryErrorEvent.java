package org.example.escrowpaymentservice.dto.event;

public record RegistryErrorEvent(
        String operation,
        Throwable cause
) implements RegistryEvent {
}
