package org.example.escrowpaymentservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Network {
    PREPROD("Preprod"),
    MAINNET("Mainnet");

    private final String wireName;

    Network(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Network fromValue(String value) {
        return Arrays.stream(values())
                .filter(network -> network.wireName.equalsIgnoreCase(value) || network.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown network: " + value));
    }
}
