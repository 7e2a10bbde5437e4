package org.example.escrowpaymentservice.dto.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import org.example.escrowpaymentservice.model.Network;
import org.example.escrowpaymentservice.model.registry.AgentCapability;
import org.example.escrowpaymentservice.model.registry.AgentPricing;
import org.example.escrowpaymentservice.model.registry.AgentState;

import java.util.List;
import java.util.Map;

/**
 * Partial update of a registered agent. Null fields are left untouched by the registry;
 * the identifier travels in the request path.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateAgentRequest(
        @JsonIgnore String agentIdentifier,
        Network network,
        String description,
        String apiBaseUrl,
        @JsonProperty("Capability") AgentCapability capability,
        @JsonProperty("Pricing") AgentPricing pricing,
        List<String> tags,
        Map<String, Object> metadata,
        AgentState state
) {
}
