package org.example.escrowpaymentservice.client.registry;

import org.example.escrowpaymentservice.client.RemoteServiceClient;
import org.example.escrowpaymentservice.client.registry.dto.RegistryResponse;
import org.example.escrowpaymentservice.core.exception.LedgerTransportException;
import org.example.escrowpaymentservice.dto.registry.AgentSearchOptions;
import org.example.escrowpaymentservice.dto.registry.RegisterAgentRequest;
import org.example.escrowpaymentservice.dto.registry.UpdateAgentRequest;
import org.example.escrowpaymentservice.model.Network;
import org.example.escrowpaymentservice.model.registry.RegisteredAgent;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;

@Component
public class RestRegistryClient extends RemoteServiceClient implements RegistryClient {

    private static final ParameterizedTypeReference<RegistryResponse<RegisteredAgent>> AGENT_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<RegistryResponse<List<RegisteredAgent>>> AGENT_LIST_RESPONSE =
            new ParameterizedTypeReference<>() {};

    public RestRegistryClient(@Qualifier("registryRestClient") RestClient restClient) {
        super(restClient);
    }

    @Override
    public RegisteredAgent registerAgent(RegisterAgentRequest request) {
        return unwrap("Register agent", call("Register agent", () -> restClient.post()
                .uri("/registry")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(AGENT_RESPONSE)));
    }

    @Override
    public RegisteredAgent getAgent(String agentIdentifier, Network network) {
        return unwrap("Get agent", call("Get agent", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/registry/{agentIdentifier}")
                        .queryParam("network", network.getWireName())
                        .build(agentIdentifier))
                .retrieve()
                .body(AGENT_RESPONSE)));
    }

    @Override
    public List<RegisteredAgent> searchAgents(AgentSearchOptions options) {
        RegistryResponse<List<RegisteredAgent>> response = call("Search agents", () -> restClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/registry");
                    if (options.network() != null) uriBuilder.queryParam("network", options.network().getWireName());
                    if (options.capability() != null) uriBuilder.queryParam("capability", options.capability());
                    if (options.pricingType() != null) uriBuilder.queryParam("pricingType", options.pricingType().getWireName());
                    if (options.state() != null) uriBuilder.queryParam("state", options.state().getWireName());
                    if (options.limit() != null) uriBuilder.queryParam("limit", options.limit());
                    if (options.offset() != null) uriBuilder.queryParam("offset", options.offset());
                    if (options.tags() != null && !options.tags().isEmpty()) {
                        uriBuilder.queryParam("tags", String.join(",", options.tags()));
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .body(AGENT_LIST_RESPONSE));

        return response.data() == null ? List.of() : response.data();
    }

    @Override
    public RegisteredAgent updateAgent(UpdateAgentRequest request) {
        return unwrap("Update agent", call("Update agent", () -> restClient.patch()
                .uri("/registry/{agentIdentifier}", request.agentIdentifier())
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(AGENT_RESPONSE)));
    }

    private RegisteredAgent unwrap(String operation, RegistryResponse<RegisteredAgent> response) {
        if (response.data() == null) {
            throw new LedgerTransportException(operation + " returned no agent", null);
        }
        return response.data();
    }
}
