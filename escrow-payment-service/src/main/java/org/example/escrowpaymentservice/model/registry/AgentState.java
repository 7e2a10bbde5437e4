package org.example.escrowpaymentservice.model.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AgentState {
    @JsonProperty("Pending")
    PENDING("Pending"),
    @JsonProperty("Active")
    ACTIVE("Active"),
    @JsonProperty("Suspended")
    SUSPENDED("Suspended"),
    @JsonProperty("Inactive")
    INACTIVE("Inactive");

    private final String wireName;

    AgentState(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
