package org.example.escrowpaymentservice.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * A payment request as known to the escrow ledger. Instances are owned by the
 * {@link org.example.escrowpaymentservice.repository.PaymentStore}; every fetch replaces the
 * stored instance as a whole.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentRequest {

    //Assigned by the ledger on creation, primary key of the store
    private String blockchainIdentifier;

    //Salt for both input and result hashes
    private String identifierFromPurchaser;

    private PaymentState onChainState;

    private Instant payByTime;

    private Instant submitResultTime;

    @JsonProperty("RequestedFunds")
    @JsonAlias("requestedFunds")
    private List<RequestedFund> requestedFunds;

    @JsonProperty("NextAction")
    @JsonAlias("nextAction")
    private NextAction nextAction;

    private String inputHash;

    private String resultHash;

    private String network;

    private String metadata;

    @JsonIgnore
    public boolean isTerminal() {
        return PaymentState.isTerminal(onChainState);
    }

}
