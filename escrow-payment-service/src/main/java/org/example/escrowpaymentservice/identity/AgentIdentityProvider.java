package org.example.escrowpaymentservice.identity;

import org.example.escrowpaymentservice.model.AgentIdentity;

import java.util.Optional;

/**
 * Source of the agent's provisioned identity. Wallet generation and credential storage live
 * behind this interface.
 */
public interface AgentIdentityProvider {

    /**
     * @return the provisioned identity, or empty when the agent has not been provisioned yet
     */
    Optional<AgentIdentity> currentIdentity();
}
