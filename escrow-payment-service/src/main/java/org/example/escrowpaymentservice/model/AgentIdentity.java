package org.example.escrowpaymentservice.model;

import java.util.Optional;

/**
 * Signing identity handed out by agent provisioning.
 *
 * @param agentIdentifier identifier registered for the agent, required to create payments
 * @param sellerVkey      verification key of the selling wallet, scopes wallet queries
 */
public record AgentIdentity(
        String agentIdentifier,
        String sellerVkey
) {

    public Optional<String> findSellerVkey() {
        return Optional.ofNullable(sellerVkey).filter(vkey -> !vkey.isBlank());
    }
}
