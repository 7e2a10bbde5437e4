package org.example.escrowpaymentservice.service.implementation;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.example.escrowpaymentservice.client.ledger.LedgerClient;
import org.example.escrowpaymentservice.client.ledger.dto.CreatePaymentPayload;
import org.example.escrowpaymentservice.client.ledger.dto.ListPaymentsQuery;
import org.example.escrowpaymentservice.client.ledger.dto.PaymentListResponse;
import org.example.escrowpaymentservice.client.ledger.dto.PaymentReferencePayload;
import org.example.escrowpaymentservice.client.ledger.dto.SubmitResultPayload;
import org.example.escrowpaymentservice.core.event.EventDispatcher;
import org.example.escrowpaymentservice.core.event.PaymentEventListener;
import org.example.escrowpaymentservice.core.exception.AgentNotProvisionedException;
import org.example.escrowpaymentservice.core.exception.LedgerTransportException;
import org.example.escrowpaymentservice.core.exception.PaymentValidationException;
import org.example.escrowpaymentservice.core.exception.UnknownPaymentException;
import org.example.escrowpaymentservice.core.util.CanonicalHashUtil;
import org.example.escrowpaymentservice.dto.CreatePaymentCommand;
import org.example.escrowpaymentservice.dto.PaymentPage;
import org.example.escrowpaymentservice.dto.event.FundsLockedEvent;
import org.example.escrowpaymentservice.dto.event.PaymentCompletedEvent;
import org.example.escrowpaymentservice.dto.event.PaymentCreatedEvent;
import org.example.escrowpaymentservice.dto.event.PaymentEvent;
import org.example.escrowpaymentservice.dto.event.PaymentStateChangedEvent;
import org.example.escrowpaymentservice.dto.event.RefundAuthorizedEvent;
import org.example.escrowpaymentservice.dto.event.ResultSubmittedEvent;
import org.example.escrowpaymentservice.identity.AgentIdentityProvider;
import org.example.escrowpaymentservice.model.AgentIdentity;
import org.example.escrowpaymentservice.model.Network;
import org.example.escrowpaymentservice.model.PaymentRequest;
import org.example.escrowpaymentservice.model.PaymentState;
import org.example.escrowpaymentservice.model.WalletBalance;
import org.example.escrowpaymentservice.repository.PaymentStore;
import org.example.escrowpaymentservice.scheduler.PaymentMonitorScheduler;
import org.example.escrowpaymentservice.service.PaymentLifecycleService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Payment lifecycle against the escrow ledger.
 * <p>
 * Operations run one at a time: the turn lock is held across the ledger call, so this engine
 * never has more than one request in flight and events for a payment are published in the
 * order the states were observed. {@link #close()} does not wait for the turn; a response that
 * arrives after it is dropped.
 */
@Service
@Slf4j
public class PaymentLifecycleServiceImp implements PaymentLifecycleService {

    static final Duration DEFAULT_PAY_BY_WINDOW = Duration.ofHours(12);
    static final Duration DEFAULT_SUBMIT_RESULT_WINDOW = Duration.ofHours(24);
    static final int DEFAULT_PAGE_SIZE = 10;
    static final String PAYMENT_TYPE = "Web3CardanoV1";

    //Same shape as JavaScript's toISOString(), which the ledger expects
    private static final DateTimeFormatter WIRE_TIME = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final LedgerClient ledgerClient;
    private final PaymentStore paymentStore;
    private final AgentIdentityProvider identityProvider;
    private final Clock clock;
    private final Network network;
    private final Duration monitorInterval;
    private final List<PaymentEventListener> listenerBeans;

    private final EventDispatcher<PaymentEvent> events = new EventDispatcher<>("Payment");
    private final PaymentMonitorScheduler monitor;

    private final ReentrantLock turn = new ReentrantLock(true);
    private final Object commitGuard = new Object();
    private volatile boolean closed;

    public PaymentLifecycleServiceImp(LedgerClient ledgerClient, PaymentStore paymentStore,
                                      AgentIdentityProvider identityProvider, TaskScheduler taskScheduler,
                                      Clock clock, List<PaymentEventListener> listenerBeans,
                                      @Value("${app.ledger.network:Preprod}") String network,
                                      @Value("${app.monitor.interval:30s}") Duration monitorInterval) {
        this.ledgerClient = ledgerClient;
        this.paymentStore = paymentStore;
        this.identityProvider = identityProvider;
        this.clock = clock;
        this.listenerBeans = listenerBeans;
        this.network = Network.fromValue(network);
        this.monitorInterval = monitorInterval;
        this.monitor = new PaymentMonitorScheduler(taskScheduler, paymentStore,
                this::refreshStatus, events::publish, clock);
    }

    @PostConstruct
    public void registerListeners() {
        listenerBeans.forEach(events::subscribe);
        log.info("Registered {} payment event listener(s)", listenerBeans.size());
    }

    @Override
    public PaymentRequest createPaymentRequest(CreatePaymentCommand command) {
        ensureOpen();
        if (command == null || isBlank(command.identifierFromPurchaser())) {
            throw new PaymentValidationException("identifierFromPurchaser is required");
        }

        AgentIdentity identity = identityProvider.currentIdentity()
                .orElseThrow(() -> new AgentNotProvisionedException(
                        "agentIdentifier not configured. Provision the agent first or set app.agent.identifier."));

        Instant now = clock.instant();
        Instant payBy = command.payByTime() != null ? command.payByTime() : now.plus(DEFAULT_PAY_BY_WINDOW);
        Instant submitBy = command.submitResultTime() != null
                ? command.submitResultTime()
                : now.plus(DEFAULT_SUBMIT_RESULT_WINDOW);

        String purchaser = command.identifierFromPurchaser();
        String inputHash = command.inputData() != null
                ? CanonicalHashUtil.hash(command.inputData(), purchaser)
                : null;

        CreatePaymentPayload payload = new CreatePaymentPayload(
                identity.agentIdentifier(),
                network,
                PAYMENT_TYPE,
                WIRE_TIME.format(payBy),
                WIRE_TIME.format(submitBy),
                purchaser,
                inputHash,
                command.metadata()
        );

        log.info("Creating payment request for agent {} on {} (purchaser {})",
                identity.agentIdentifier(), network.getWireName(), purchaser);

        return onTurn(() -> {
            PaymentRequest created = ledgerClient.createPayment(payload);
            String blockchainIdentifier = requireAssignedIdentifier(created);
            if (created.getIdentifierFromPurchaser() == null) {
                created.setIdentifierFromPurchaser(purchaser);
            }

            commit(blockchainIdentifier, () -> {
                paymentStore.save(blockchainIdentifier, created);
                events.publish(new PaymentCreatedEvent(created));
            });

            log.info("Payment request created: {} (pay by {}, submit result by {})",
                    blockchainIdentifier, created.getPayByTime(), created.getSubmitResultTime());
            return created;
        });
    }

    @Override
    public PaymentRequest refreshStatus(String blockchainIdentifier) {
        requireIdentifier(blockchainIdentifier);

        return onTurn(() -> {
            PaymentRequest fresh = ledgerClient.resolvePayment(new PaymentReferencePayload(blockchainIdentifier, network));

            commit(blockchainIdentifier, () -> {
                Optional<PaymentRequest> cached = paymentStore.findById(blockchainIdentifier);
                PaymentState previousState = cached.map(PaymentRequest::getOnChainState).orElse(null);
                carryOverIdentity(blockchainIdentifier, cached, fresh);

                paymentStore.save(blockchainIdentifier, fresh);

                if (previousState != fresh.getOnChainState()) {
                    publishTransition(blockchainIdentifier, previousState, fresh);
                }
            });

            return fresh;
        });
    }

    @Override
    public PaymentRequest submitResult(String blockchainIdentifier, Object outputData) {
        requireIdentifier(blockchainIdentifier);
        if (outputData == null) {
            throw new PaymentValidationException("outputData is required");
        }

        return onTurn(() -> {
            PaymentRequest cached = paymentStore.findById(blockchainIdentifier)
                    .orElseThrow(() -> new UnknownPaymentException(blockchainIdentifier));

            String resultHash = CanonicalHashUtil.hash(outputData, cached.getIdentifierFromPurchaser());
            log.info("Submitting result for {} (hash {})", blockchainIdentifier, resultHash);

            PaymentRequest updated = ledgerClient.submitResult(
                    new SubmitResultPayload(blockchainIdentifier, network, resultHash));

            commit(blockchainIdentifier, () -> {
                carryOverIdentity(blockchainIdentifier, Optional.of(cached), updated);
                paymentStore.save(blockchainIdentifier, updated);
                events.publish(new ResultSubmittedEvent(blockchainIdentifier, resultHash));
            });

            log.info("Result submitted for {}, next action: {}", blockchainIdentifier,
                    updated.getNextAction() != null ? updated.getNextAction().requestedAction() : "none");
            return updated;
        });
    }

    @Override
    public PaymentRequest authorizeRefund(String blockchainIdentifier) {
        requireIdentifier(blockchainIdentifier);
        log.info("Authorizing refund for {}", blockchainIdentifier);

        return onTurn(() -> {
            PaymentRequest updated = ledgerClient.authorizeRefund(new PaymentReferencePayload(blockchainIdentifier, network));

            commit(blockchainIdentifier, () -> {
                carryOverIdentity(blockchainIdentifier, paymentStore.findById(blockchainIdentifier), updated);
                paymentStore.save(blockchainIdentifier, updated);
                events.publish(new RefundAuthorizedEvent(blockchainIdentifier));
            });

            log.info("Refund authorized for {}", blockchainIdentifier);
            return updated;
        });
    }

    @Override
    public PaymentPage listPayments(String cursorId, Integer limit, String filterSmartContractAddress) {
        int pageSize = limit != null ? limit : DEFAULT_PAGE_SIZE;
        if (pageSize <= 0) {
            throw new PaymentValidationException("limit must be positive, got " + pageSize);
        }

        ListPaymentsQuery query = new ListPaymentsQuery(network, pageSize, cursorId, filterSmartContractAddress);
        PaymentListResponse response = onTurn(() -> ledgerClient.listPayments(query));

        return new PaymentPage(response.data(), response.nextCursorId());
    }

    @Override
    public WalletBalance getWalletBalance() {
        identityProvider.currentIdentity()
                .flatMap(AgentIdentity::findSellerVkey)
                .orElseThrow(() -> new AgentNotProvisionedException("sellerVkey not configured. Cannot query wallet balance."));

        return onTurn(() -> ledgerClient.getWalletBalance(network));
    }

    @Override
    public Optional<PaymentRequest> getPayment(String blockchainIdentifier) {
        return paymentStore.findById(blockchainIdentifier);
    }

    @Override
    public Map<String, PaymentRequest> getTrackedPayments() {
        return paymentStore.snapshot();
    }

    @Override
    public int cleanupCompletedPayments() {
        int removed = paymentStore.removeTerminal();
        if (removed > 0) {
            log.info("Cleaned up {} completed payment(s)", removed);
        }
        return removed;
    }

    @Override
    public void subscribe(PaymentEventListener listener) {
        ensureOpen();
        events.subscribe(listener);
    }

    @Override
    public boolean unsubscribe(PaymentEventListener listener) {
        return events.unsubscribe(listener);
    }

    @Override
    public boolean startMonitoring() {
        return startMonitoring(monitorInterval);
    }

    @Override
    public boolean startMonitoring(Duration interval) {
        ensureOpen();
        return monitor.start(interval);
    }

    @Override
    public void stopMonitoring() {
        monitor.stop();
    }

    @Override
    public boolean isMonitoring() {
        return monitor.isRunning();
    }

    @Override
    public void close() {
        if (closed) return;

        monitor.stop();
        synchronized (commitGuard) {
            closed = true;
            paymentStore.clear();
            events.clear();
        }
        log.info("Payment lifecycle engine closed");
    }

    private void publishTransition(String blockchainIdentifier, PaymentState previousState, PaymentRequest payment) {
        PaymentState newState = payment.getOnChainState();
        events.publish(new PaymentStateChangedEvent(blockchainIdentifier, previousState, newState, payment));

        if (newState == PaymentState.FUNDS_LOCKED) {
            log.info("Payment received (FundsLocked): {}", blockchainIdentifier);
            events.publish(new FundsLockedEvent(payment));
        } else if (newState == PaymentState.WITHDRAWN) {
            log.info("Payment completed (Withdrawn): {}", blockchainIdentifier);
            events.publish(new PaymentCompletedEvent(payment));
        } else {
            log.info("Payment {} moved from {} to {}", blockchainIdentifier, previousState, newState);
        }
    }

    private <T> T onTurn(Supplier<T> operation) {
        ensureOpen();
        turn.lock();
        try {
            ensureOpen();
            return operation.get();
        } finally {
            turn.unlock();
        }
    }

    private void commit(String blockchainIdentifier, Runnable mutation) {
        synchronized (commitGuard) {
            if (closed) {
                log.warn("Engine closed while a ledger call for {} was in flight, discarding its result", blockchainIdentifier);
                return;
            }
            mutation.run();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Payment lifecycle engine is closed");
        }
    }

    //Neither identifier ever changes, keep them when the ledger leaves them out
    private static void carryOverIdentity(String blockchainIdentifier, Optional<PaymentRequest> cached,
                                          PaymentRequest fresh) {
        if (isBlank(fresh.getBlockchainIdentifier())) {
            fresh.setBlockchainIdentifier(blockchainIdentifier);
        }
        if (fresh.getIdentifierFromPurchaser() == null) {
            cached.map(PaymentRequest::getIdentifierFromPurchaser)
                    .ifPresent(fresh::setIdentifierFromPurchaser);
        }
    }

    private static String requireAssignedIdentifier(PaymentRequest created) {
        if (isBlank(created.getBlockchainIdentifier())) {
            throw new LedgerTransportException("Ledger returned a payment without blockchainIdentifier", null);
        }
        return created.getBlockchainIdentifier();
    }

    private static void requireIdentifier(String blockchainIdentifier) {
        if (isBlank(blockchainIdentifier)) {
            throw new PaymentValidationException("blockchainIdentifier is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
