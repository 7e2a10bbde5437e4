package org.example.escrowpaymentservice.dto.event;

import org.example.escrowpaymentservice.model.registry.RegisteredAgent;

public record AgentUpdatedEvent(
        RegisteredAgent agent
) implements RegistryEvent {
}
