package org.example.escrowpaymentservice.model.registry;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.escrowpaymentservice.model.Network;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegisteredAgent {

    private String agentIdentifier;

    private AgentState state;

    private Network network;

    private String name;

    private String description;

    private String apiBaseUrl;

    @JsonProperty("Capability")
    @JsonAlias("capability")
    private AgentCapability capability;

    @JsonProperty("Author")
    @JsonAlias("author")
    private AgentAuthor author;

    @JsonProperty("Pricing")
    @JsonAlias("pricing")
    private AgentPricing pricing;

    private List<String> tags;

    private Map<String, Object> metadata;

    private Instant createdAt;

    private Instant updatedAt;

}
