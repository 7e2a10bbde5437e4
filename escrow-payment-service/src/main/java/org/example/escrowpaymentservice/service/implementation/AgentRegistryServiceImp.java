package org.example.escrowpaymentservice.service.implementation;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.example.escrowpaymentservice.client.registry.RegistryClient;
import org.example.escrowpaymentservice.core.event.EventDispatcher;
import org.example.escrowpaymentservice.core.event.RegistryEventListener;
import org.example.escrowpaymentservice.core.exception.LedgerTransportException;
import org.example.escrowpaymentservice.core.exception.PaymentValidationException;
import org.example.escrowpaymentservice.dto.event.AgentRegisteredEvent;
import org.example.escrowpaymentservice.dto.event.AgentStateChangedEvent;
import org.example.escrowpaymentservice.dto.event.AgentUpdatedEvent;
import org.example.escrowpaymentservice.dto.event.RegistryErrorEvent;
import org.example.escrowpaymentservice.dto.event.RegistryEvent;
import org.example.escrowpaymentservice.dto.registry.AgentSearchOptions;
import org.example.escrowpaymentservice.dto.registry.RegisterAgentRequest;
import org.example.escrowpaymentservice.dto.registry.UpdateAgentRequest;
import org.example.escrowpaymentservice.model.Network;
import org.example.escrowpaymentservice.model.registry.AgentState;
import org.example.escrowpaymentservice.model.registry.RegisteredAgent;
import org.example.escrowpaymentservice.service.AgentRegistryService;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

@Service
@Slf4j
public class AgentRegistryServiceImp implements AgentRegistryService {

    static final int DEFAULT_PAGE_SIZE = 10;

    private final RegistryClient registryClient;
    private final List<RegistryEventListener> listenerBeans;

    private final Map<String, RegisteredAgent> registeredAgents = new ConcurrentHashMap<>();
    private final EventDispatcher<RegistryEvent> events = new EventDispatcher<>("Registry");

    public AgentRegistryServiceImp(RegistryClient registryClient, List<RegistryEventListener> listenerBeans) {
        this.registryClient = registryClient;
        this.listenerBeans = listenerBeans;
    }

    @PostConstruct
    public void registerListeners() {
        listenerBeans.forEach(events::subscribe);
    }

    @Override
    public RegisteredAgent registerAgent(RegisterAgentRequest request) {
        if (request == null || request.network() == null || isBlank(request.name())) {
            throw new PaymentValidationException("Agent registration requires a network and a name");
        }

        RegisteredAgent agent = reported("registerAgent", () -> requireAssignedIdentifier(registryClient.registerAgent(request)));
        registeredAgents.put(agent.getAgentIdentifier(), agent);
        events.publish(new AgentRegisteredEvent(agent));

        log.info("Agent registered: {} ({}, state {})", agent.getAgentIdentifier(), agent.getName(), agent.getState());
        return agent;
    }

    @Override
    public RegisteredAgent getAgent(String agentIdentifier, Network network) {
        requireIdentifier(agentIdentifier);

        RegisteredAgent agent = reported("getAgent", () -> requireAssignedIdentifier(registryClient.getAgent(agentIdentifier, network)));
        registeredAgents.put(agent.getAgentIdentifier(), agent);
        return agent;
    }

    @Override
    public List<RegisteredAgent> searchAgents(AgentSearchOptions options) {
        AgentSearchOptions effective = options != null ? options : AgentSearchOptions.none();
        return reported("searchAgents", () -> registryClient.searchAgents(effective));
    }

    @Override
    public List<RegisteredAgent> listAgents(Network network) {
        return listAgents(network, DEFAULT_PAGE_SIZE, 0);
    }

    @Override
    public List<RegisteredAgent> listAgents(Network network, int limit, int offset) {
        return searchAgents(AgentSearchOptions.builder()
                .network(network)
                .limit(limit)
                .offset(offset)
                .build());
    }

    @Override
    public RegisteredAgent updateAgent(UpdateAgentRequest request) {
        if (request == null) {
            throw new PaymentValidationException("Update request is required");
        }
        requireIdentifier(request.agentIdentifier());

        RegisteredAgent previous = registeredAgents.get(request.agentIdentifier());
        RegisteredAgent agent = reported("updateAgent", () -> requireAssignedIdentifier(registryClient.updateAgent(request)));

        registeredAgents.put(agent.getAgentIdentifier(), agent);
        events.publish(new AgentUpdatedEvent(agent));

        if (previous != null && previous.getState() != agent.getState()) {
            log.info("Agent {} moved from {} to {}", agent.getAgentIdentifier(), previous.getState(), agent.getState());
            events.publish(new AgentStateChangedEvent(agent.getAgentIdentifier(), previous.getState(), agent.getState()));
        }
        return agent;
    }

    @Override
    public RegisteredAgent activateAgent(String agentIdentifier, Network network) {
        return changeState(agentIdentifier, network, AgentState.ACTIVE);
    }

    @Override
    public RegisteredAgent deactivateAgent(String agentIdentifier, Network network) {
        return changeState(agentIdentifier, network, AgentState.INACTIVE);
    }

    @Override
    public Map<String, RegisteredAgent> getCachedAgents() {
        return Map.copyOf(registeredAgents);
    }

    @Override
    public void clearCache() {
        registeredAgents.clear();
    }

    @Override
    public void subscribe(RegistryEventListener listener) {
        events.subscribe(listener);
    }

    @Override
    public void close() {
        clearCache();
        events.clear();
    }

    private RegisteredAgent changeState(String agentIdentifier, Network network, AgentState state) {
        return updateAgent(UpdateAgentRequest.builder()
                .agentIdentifier(agentIdentifier)
                .network(network)
                .state(state)
                .build());
    }

    private <T> T reported(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            events.publish(new RegistryErrorEvent(operation, e));
            throw e;
        }
    }

    private static RegisteredAgent requireAssignedIdentifier(RegisteredAgent agent) {
        if (isBlank(agent.getAgentIdentifier())) {
            throw new LedgerTransportException("Registry returned an agent without agentIdentifier", null);
        }
        return agent;
    }

    private static void requireIdentifier(String agentIdentifier) {
        if (isBlank(agentIdentifier)) {
            throw new PaymentValidationException("agentIdentifier is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
