package org.example.escrowpaymentservice.dto.event;

import org.example.escrowpaymentservice.model.registry.AgentState;

public record AgentStateChangedEvent(
        String agentIdentifier,
        AgentState previousState,
        AgentState newState
) implements RegistryEvent {
}
