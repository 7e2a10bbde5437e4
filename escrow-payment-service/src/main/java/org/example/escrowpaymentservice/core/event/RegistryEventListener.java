package org.example.escrowpaymentservice.core.event;

import org.example.escrowpaymentservice.dto.event.RegistryEvent;

@FunctionalInterface
public interface RegistryEventListener extends DomainEventListener<RegistryEvent> {
}
