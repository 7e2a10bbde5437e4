package org.example.escrowpaymentservice.dto.registry;

import lombok.Builder;
import org.example.escrowpaymentservice.model.Network;
import org.example.escrowpaymentservice.model.registry.AgentState;
import org.example.escrowpaymentservice.model.registry.PricingType;

import java.util.List;

@Builder
public record AgentSearchOptions(
        Network network,
        String capability,
        List<String> tags,
        PricingType pricingType,
        AgentState state,
        Integer limit,
        Integer offset
) {

    public static AgentSearchOptions none() {
        return AgentSearchOptions.builder().build();
    }
}
