package org.example.escrowpaymentservice;

import org.example.escrowpaymentservice.client.registry.RestRegistryClient;
import org.example.escrowpaymentservice.core.exception.LedgerTransportException;
import org.example.escrowpaymentservice.dto.registry.AgentSearchOptions;
import org.example.escrowpaymentservice.dto.registry.RegisterAgentRequest;
import org.example.escrowpaymentservice.dto.registry.UpdateAgentRequest;
import org.example.escrowpaymentservice.model.Network;
import org.example.escrowpaymentservice.model.registry.AgentCapability;
import org.example.escrowpaymentservice.model.registry.AgentPricing;
import org.example.escrowpaymentservice.model.registry.AgentState;
import org.example.escrowpaymentservice.model.registry.PricingType;
import org.example.escrowpaymentservice.model.registry.RegisteredAgent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestRegistryClientTest {

    private static final String BASE_URL = "http://registry.test/api/v1";

    private static final String AGENT_JSON = """
            {
              "agentIdentifier": "agent-1",
              "state": "%s",
              "network": "Preprod",
              "name": "Summarizer",
              "apiBaseUrl": "https://agent.example.com",
              "Capability": {"name": "summarize", "version": "1.0.0"},
              "Pricing": {"pricingType": "Fixed", "amounts": [{"amount": "5000000", "unit": "lovelace"}]},
              "tags": ["nlp"],
              "createdAt": "2025-05-30T08:00:00.000Z"
            }
            """;

    private MockRestServiceServer server;
    private RestRegistryClient registryClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        registryClient = new RestRegistryClient(builder.build());
    }

    private static String wrapped(String data) {
        return "{\"status\": \"success\", \"data\": " + data + "}";
    }

    @Test
    @DisplayName("Register posts the agent description and unwraps the data envelope")
    void testRegisterAgent() {
        server.expect(requestTo(BASE_URL + "/registry"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.name").value("Summarizer"))
                .andExpect(jsonPath("$.network").value("Preprod"))
                .andExpect(jsonPath("$.Capability.name").value("summarize"))
                .andExpect(jsonPath("$.Pricing.pricingType").value("Fixed"))
                .andRespond(withSuccess(wrapped(AGENT_JSON.formatted("Pending")), MediaType.APPLICATION_JSON));

        RegisteredAgent agent = registryClient.registerAgent(RegisterAgentRequest.builder()
                .network(Network.PREPROD)
                .name("Summarizer")
                .apiBaseUrl("https://agent.example.com")
                .capability(new AgentCapability("summarize", "1.0.0", null))
                .pricing(new AgentPricing(PricingType.FIXED, List.of(new AgentPricing.PriceAmount("5000000", "lovelace")), null))
                .build());

        server.verify();
        assertThat(agent.getAgentIdentifier()).isEqualTo("agent-1");
        assertThat(agent.getState()).isEqualTo(AgentState.PENDING);
        assertThat(agent.getCapability().name()).isEqualTo("summarize");
        assertThat(agent.getPricing().pricingType()).isEqualTo(PricingType.FIXED);
    }

    @Test
    @DisplayName("Get reads a single agent by identifier")
    void testGetAgent() {
        server.expect(requestTo(BASE_URL + "/registry/agent-1?network=Preprod"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(wrapped(AGENT_JSON.formatted("Active")), MediaType.APPLICATION_JSON));

        RegisteredAgent agent = registryClient.getAgent("agent-1", Network.PREPROD);

        server.verify();
        assertThat(agent.getState()).isEqualTo(AgentState.ACTIVE);
        assertThat(agent.getTags()).containsExactly("nlp");
    }

    @Test
    @DisplayName("Search sends only the filters that are set")
    void testSearchAgents() {
        server.expect(requestTo(startsWith(BASE_URL + "/registry?")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("capability", "summarize"))
                .andExpect(queryParam("tags", "nlp,fast"))
                .andExpect(queryParam("limit", "20"))
                .andRespond(withSuccess(wrapped("[" + AGENT_JSON.formatted("Active") + "]"), MediaType.APPLICATION_JSON));

        List<RegisteredAgent> agents = registryClient.searchAgents(AgentSearchOptions.builder()
                .capability("summarize")
                .tags(List.of("nlp", "fast"))
                .limit(20)
                .build());

        server.verify();
        assertThat(agents).extracting(RegisteredAgent::getAgentIdentifier).containsExactly("agent-1");
    }

    @Test
    @DisplayName("Update patches the agent and keeps the identifier in the path only")
    void testUpdateAgent() {
        server.expect(requestTo(BASE_URL + "/registry/agent-1"))
                .andExpect(method(HttpMethod.PATCH))
                .andExpect(jsonPath("$.state").value("Inactive"))
                .andExpect(jsonPath("$.agentIdentifier").doesNotExist())
                .andExpect(jsonPath("$.description").doesNotExist())
                .andRespond(withSuccess(wrapped(AGENT_JSON.formatted("Inactive")), MediaType.APPLICATION_JSON));

        RegisteredAgent agent = registryClient.updateAgent(UpdateAgentRequest.builder()
                .agentIdentifier("agent-1")
                .network(Network.PREPROD)
                .state(AgentState.INACTIVE)
                .build());

        server.verify();
        assertThat(agent.getState()).isEqualTo(AgentState.INACTIVE);
    }

    @Test
    @DisplayName("An envelope without data is reported as a failure")
    void testGetAgent_EmptyData() {
        server.expect(requestTo(BASE_URL + "/registry/agent-1?network=Preprod"))
                .andRespond(withSuccess("{\"status\": \"success\", \"data\": null}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> registryClient.getAgent("agent-1", Network.PREPROD))
                .isInstanceOf(LedgerTransportException.class)
                .hasMessageContaining("returned no agent");
    }

    @Test
    @DisplayName("Registry errors carry the HTTP status")
    void testHttpError() {
        server.expect(requestTo(BASE_URL + "/registry/missing?network=Preprod"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND).body("Agent not found"));

        assertThatThrownBy(() -> registryClient.getAgent("missing", Network.PREPROD))
                .isInstanceOf(LedgerTransportException.class)
                .hasMessageContaining("HTTP 404");
    }
}
