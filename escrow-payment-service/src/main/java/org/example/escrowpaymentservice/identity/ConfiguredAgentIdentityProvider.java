package org.example.escrowpaymentservice.identity;

import org.example.escrowpaymentservice.model.AgentIdentity;

import java.util.Optional;

/**
 * Identity read from application configuration. A blank agent identifier means the agent is
 * not provisioned.
 */
public class ConfiguredAgentIdentityProvider implements AgentIdentityProvider {

    private final String agentIdentifier;
    private final String sellerVkey;

    public ConfiguredAgentIdentityProvider(String agentIdentifier, String sellerVkey) {
        this.agentIdentifier = agentIdentifier;
        this.sellerVkey = sellerVkey;
    }

    @Override
    public Optional<AgentIdentity> currentIdentity() {
        if (agentIdentifier == null || agentIdentifier.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new AgentIdentity(agentIdentifier, sellerVkey));
    }
}
