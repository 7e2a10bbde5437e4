package org.example.escrowpaymentservice.model.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentPricing(
        PricingType pricingType,
        List<PriceAmount> amounts,
        String description
) {

    //amount is in lovelace when unit is "lovelace"
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PriceAmount(
            String amount,
            String unit
    ) {
    }
}
