package org.example.escrowpaymentservice.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Balance of the selling wallet. {@code ada} is expressed in lovelace.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalletBalance(
        String ada,
        List<TokenBalance> tokens
) {

    public WalletBalance {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TokenBalance(
            String unit,
            String quantity
    ) {
    }
}
