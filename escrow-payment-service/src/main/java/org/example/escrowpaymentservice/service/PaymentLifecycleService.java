package org.example.escrowpaymentservice.service;

import org.example.escrowpaymentservice.core.event.PaymentEventListener;
import org.example.escrowpaymentservice.dto.CreatePaymentCommand;
import org.example.escrowpaymentservice.dto.PaymentPage;
import org.example.escrowpaymentservice.model.PaymentRequest;
import org.example.escrowpaymentservice.model.WalletBalance;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

public interface PaymentLifecycleService extends AutoCloseable {

    PaymentRequest createPaymentRequest(CreatePaymentCommand command);

    PaymentRequest refreshStatus(String blockchainIdentifier);

    PaymentRequest submitResult(String blockchainIdentifier, Object outputData);

    PaymentRequest authorizeRefund(String blockchainIdentifier);

    PaymentPage listPayments(String cursorId, Integer limit, String filterSmartContractAddress);

    WalletBalance getWalletBalance();

    Optional<PaymentRequest> getPayment(String blockchainIdentifier);

    Map<String, PaymentRequest> getTrackedPayments();

    int cleanupCompletedPayments();

    void subscribe(PaymentEventListener listener);

    boolean unsubscribe(PaymentEventListener listener);

    boolean startMonitoring();

    boolean startMonitoring(Duration interval);

    void stopMonitoring();

    boolean isMonitoring();

    @Override
    void close();
}
