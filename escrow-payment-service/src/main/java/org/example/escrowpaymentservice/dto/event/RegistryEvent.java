package org.example.escrowpaymentservice.dto.event;

/**
 * Notification emitted by the agent registry service.
 */
public interface RegistryEvent {
}
