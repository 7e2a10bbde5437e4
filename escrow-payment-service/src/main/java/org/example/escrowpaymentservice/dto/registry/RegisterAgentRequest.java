package org.example.escrowpaymentservice.dto.registry;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import org.example.escrowpaymentservice.model.Network;
import org.example.escrowpaymentservice.model.registry.AgentAuthor;
import org.example.escrowpaymentservice.model.registry.AgentCapability;
import org.example.escrowpaymentservice.model.registry.AgentPricing;

import java.util.List;
import java.util.Map;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegisterAgentRequest(
        Network network,
        String name,
        String description,
        String apiBaseUrl,
        @JsonProperty("Capability") AgentCapability capability,
        @JsonProperty("Author") AgentAuthor author,
        @JsonProperty("Pricing") AgentPricing pricing,
        List<String> tags,
        Map<String, Object> metadata
) {
}
