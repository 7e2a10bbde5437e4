package org.example.escrowpaymentservice;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import org.example.escrowpaymentservice.core.exception.LedgerTransportException;
import org.example.escrowpaymentservice.dto.CreatePaymentCommand;
import org.example.escrowpaymentservice.model.Network;
import org.example.escrowpaymentservice.model.PaymentState;
import org.example.escrowpaymentservice.model.WalletBalance;
import org.example.escrowpaymentservice.model.registry.AgentState;
import org.example.escrowpaymentservice.model.registry.RegisteredAgent;
import org.example.escrowpaymentservice.scheduler.MonitorAutoStarter;
import org.example.escrowpaymentservice.service.AgentRegistryService;
import org.example.escrowpaymentservice.service.PaymentLifecycleService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.example.escrowpaymentservice.PaymentFixtures.paymentJson;

@SpringBootTest(properties = {
        "app.ledger.api-key=test-key",
        "app.agent.identifier=agent-1",
        "app.agent.seller-vkey=vkey-1"
})
class PaymentServiceIntegrationTest {

    @RegisterExtension
    static WireMockExtension ledger = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    @DynamicPropertySource
    static void ledgerProperties(DynamicPropertyRegistry registry) {
        registry.add("app.ledger.base-url", ledger::baseUrl);
    }

    @Autowired
    private ApplicationContext context;

    @Autowired
    private PaymentLifecycleService paymentService;

    @Autowired
    private AgentRegistryService registryService;

    @Test
    void shouldWireEngineWithoutStartingMonitor() {
        assertThat(paymentService.isMonitoring()).isFalse();
        assertThat(context.getBeanNamesForType(MonitorAutoStarter.class)).isEmpty();
    }

    @Test
    void shouldSendCredentialsAndTrackCreatedPayment() {
        ledger.stubFor(post(urlEqualTo("/payment"))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "application/json")
                        .withBody(paymentJson("bc-int-1", null))
                        .withStatus(200)));
        ledger.stubFor(post(urlEqualTo("/payment/resolve-blockchain-identifier"))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "application/json")
                        .withBody(paymentJson("bc-int-1", "FundsLocked"))
                        .withStatus(200)));

        paymentService.createPaymentRequest(CreatePaymentCommand.builder()
                .identifierFromPurchaser("buyer1")
                .inputData(Map.of("task", "sum"))
                .build());
        paymentService.refreshStatus("bc-int-1");

        ledger.verify(postRequestedFor(urlEqualTo("/payment"))
                .withHeader("token", equalTo("test-key"))
                .withHeader("X-Seller-Vkey", equalTo("vkey-1"))
                .withRequestBody(matchingJsonPath("$.agentIdentifier", equalTo("agent-1")))
                .withRequestBody(matchingJsonPath("$.inputHash", equalTo(PaymentFixtures.TASK_SUM_INPUT_HASH))));
        assertThat(paymentService.getPayment("bc-int-1"))
                .hasValueSatisfying(payment -> assertThat(payment.getOnChainState()).isEqualTo(PaymentState.FUNDS_LOCKED));
    }

    @Test
    void shouldSurfaceLedgerErrors() {
        ledger.stubFor(post(urlEqualTo("/payment/authorize-refund"))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"error\":\"Refund window closed\"}")
                        .withStatus(409)));

        LedgerTransportException error = catchThrowableOfType(LedgerTransportException.class,
                () -> paymentService.authorizeRefund("bc-int-2"));

        assertThat(error.getStatusCode()).hasValue(409);
        assertThat(error).hasMessageContaining("Refund window closed");
        assertThat(paymentService.getPayment("bc-int-2")).isEmpty();
    }

    @Test
    void shouldReadWalletBalance() {
        ledger.stubFor(get(urlPathEqualTo("/wallet"))
                .withQueryParam("network", equalTo("Preprod"))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"ada\":\"7000000\",\"tokens\":[]}")
                        .withStatus(200)));

        WalletBalance balance = paymentService.getWalletBalance();

        assertThat(balance.ada()).isEqualTo("7000000");
        assertThat(balance.tokens()).isEmpty();
    }

    @Test
    void shouldUseLedgerUrlForRegistryByDefault() {
        ledger.stubFor(get(urlPathEqualTo("/registry/agent-1"))
                .withQueryParam("network", equalTo("Preprod"))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"status\":\"success\",\"data\":{\"agentIdentifier\":\"agent-1\",\"name\":\"Summarizer\",\"state\":\"Active\"}}")
                        .withStatus(200)));

        RegisteredAgent agent = registryService.getAgent("agent-1", Network.PREPROD);

        assertThat(agent.getState()).isEqualTo(AgentState.ACTIVE);
        assertThat(registryService.getCachedAgents()).containsKey("agent-1");
        ledger.verify(getRequestedFor(urlPathEqualTo("/registry/agent-1")).withHeader("token", equalTo("test-key")));
    }
}
