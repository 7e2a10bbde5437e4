package org.example.escrowpaymentservice.client.ledger;

import org.example.escrowpaymentservice.client.RemoteServiceClient;
import org.example.escrowpaymentservice.client.ledger.dto.CreatePaymentPayload;
import org.example.escrowpaymentservice.client.ledger.dto.ListPaymentsQuery;
import org.example.escrowpaymentservice.client.ledger.dto.PaymentListResponse;
import org.example.escrowpaymentservice.client.ledger.dto.PaymentReferencePayload;
import org.example.escrowpaymentservice.client.ledger.dto.SubmitResultPayload;
import org.example.escrowpaymentservice.model.Network;
import org.example.escrowpaymentservice.model.PaymentRequest;
import org.example.escrowpaymentservice.model.WalletBalance;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class RestLedgerClient extends RemoteServiceClient implements LedgerClient {

    public RestLedgerClient(@Qualifier("ledgerRestClient") RestClient restClient) {
        super(restClient);
    }

    @Override
    public PaymentRequest createPayment(CreatePaymentPayload payload) {
        return post("Create payment", "/payment", payload);
    }

    @Override
    public PaymentRequest resolvePayment(PaymentReferencePayload payload) {
        return post("Resolve payment", "/payment/resolve-blockchain-identifier", payload);
    }

    @Override
    public PaymentRequest submitResult(SubmitResultPayload payload) {
        return post("Submit result", "/payment/submit-result", payload);
    }

    @Override
    public PaymentRequest authorizeRefund(PaymentReferencePayload payload) {
        return post("Authorize refund", "/payment/authorize-refund", payload);
    }

    @Override
    public PaymentListResponse listPayments(ListPaymentsQuery query) {
        return call("List payments", () -> restClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/payment")
                            .queryParam("network", query.network().getWireName())
                            .queryParam("limit", query.limit());
                    if (query.cursorId() != null) {
                        uriBuilder.queryParam("cursorId", query.cursorId());
                    }
                    if (query.filterSmartContractAddress() != null) {
                        uriBuilder.queryParam("filterSmartContractAddress", query.filterSmartContractAddress());
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .body(PaymentListResponse.class));
    }

    @Override
    public WalletBalance getWalletBalance(Network network) {
        return call("Get wallet balance", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/wallet")
                        .queryParam("network", network.getWireName())
                        .build())
                .retrieve()
                .body(WalletBalance.class));
    }

    private PaymentRequest post(String operation, String path, Object payload) {
        return call(operation, () -> restClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(PaymentRequest.class));
    }
}
