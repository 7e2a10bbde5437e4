package org.example.escrowpaymentservice.client.registry;

import org.example.escrowpaymentservice.dto.registry.AgentSearchOptions;
import org.example.escrowpaymentservice.dto.registry.RegisterAgentRequest;
import org.example.escrowpaymentservice.dto.registry.UpdateAgentRequest;
import org.example.escrowpaymentservice.model.Network;
import org.example.escrowpaymentservice.model.registry.RegisteredAgent;

import java.util.List;

/** Contract of the agent registry endpoints of the escrow service. */
public interface RegistryClient {

    RegisteredAgent registerAgent(RegisterAgentRequest request);

    RegisteredAgent getAgent(String agentIdentifier, Network network);

    List<RegisteredAgent> searchAgents(AgentSearchOptions options);

    RegisteredAgent updateAgent(UpdateAgentRequest request);
}
