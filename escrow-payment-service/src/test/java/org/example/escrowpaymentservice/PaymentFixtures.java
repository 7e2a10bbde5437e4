package org.example.escrowpaymentservice;

import org.example.escrowpaymentservice.model.NextAction;
import org.example.escrowpaymentservice.model.PaymentRequest;
import org.example.escrowpaymentservice.model.PaymentState;

import java.time.Instant;

final class PaymentFixtures {

    static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

    // sha256("{\"task\":\"sum\"};buyer1")
    static final String TASK_SUM_INPUT_HASH = "26959fbaba8d6d1d90bd39a8fa0beae77ac9ec1a4ef2eb0b8e6cf404f2ffd09c";
    // sha256("{\"sum\":42};buyer1")
    static final String SUM_42_RESULT_HASH = "d4fce001f18e0f29f8c21ec2189141ef8e19b13ffb4265fe11014c8c83d30334";

    private PaymentFixtures() {}

    static PaymentRequest payment(String blockchainIdentifier, String purchaser, PaymentState state) {
        return PaymentRequest.builder()
                .blockchainIdentifier(blockchainIdentifier)
                .identifierFromPurchaser(purchaser)
                .onChainState(state)
                .payByTime(NOW.plusSeconds(12 * 3600))
                .submitResultTime(NOW.plusSeconds(24 * 3600))
                .nextAction(new NextAction("None", null, null))
                .build();
    }

    static String paymentJson(String blockchainIdentifier, String state) {
        String onChainState = state == null ? "null" : "\"" + state + "\"";
        return """
                {
                  "blockchainIdentifier": "%s",
                  "identifierFromPurchaser": "buyer1",
                  "onChainState": %s,
                  "payByTime": "2025-06-01T22:00:00.000Z",
                  "submitResultTime": "2025-06-02T10:00:00.000Z",
                  "inputHash": "%s",
                  "NextAction": {"requestedAction": "WaitingForExternalAction", "errorType": null, "errorNote": null},
                  "RequestedFunds": [{"amount": "10000000", "unit": "lovelace"}],
                  "unexpectedField": 1
                }
                """.formatted(blockchainIdentifier, onChainState, TASK_SUM_INPUT_HASH);
    }
}
