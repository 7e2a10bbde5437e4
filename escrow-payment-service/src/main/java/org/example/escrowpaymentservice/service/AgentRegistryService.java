package org.example.escrowpaymentservice.service;

import org.example.escrowpaymentservice.core.event.RegistryEventListener;
import org.example.escrowpaymentservice.dto.registry.AgentSearchOptions;
import org.example.escrowpaymentservice.dto.registry.RegisterAgentRequest;
import org.example.escrowpaymentservice.dto.registry.UpdateAgentRequest;
import org.example.escrowpaymentservice.model.Network;
import org.example.escrowpaymentservice.model.registry.RegisteredAgent;

import java.util.List;
import java.util.Map;

public interface AgentRegistryService extends AutoCloseable {

    RegisteredAgent registerAgent(RegisterAgentRequest request);

    RegisteredAgent getAgent(String agentIdentifier, Network network);

    List<RegisteredAgent> searchAgents(AgentSearchOptions options);

    List<RegisteredAgent> listAgents(Network network);

    List<RegisteredAgent> listAgents(Network network, int limit, int offset);

    RegisteredAgent updateAgent(UpdateAgentRequest request);

    RegisteredAgent activateAgent(String agentIdentifier, Network network);

    RegisteredAgent deactivateAgent(String agentIdentifier, Network network);

    Map<String, RegisteredAgent> getCachedAgents();

    void clearCache();

    void subscribe(RegistryEventListener listener);

    @Override
    void close();
}
