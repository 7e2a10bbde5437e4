package org.example.escrowpaymentservice.model.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PricingType {
    @JsonProperty("Fixed")
    FIXED("Fixed"),
    @JsonProperty("Variable")
    VARIABLE("Variable"),
    @JsonProperty("Free")
    FREE("Free");

    private final String wireName;

    PricingType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
