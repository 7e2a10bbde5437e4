package org.example.escrowpaymentservice.repository;

import org.example.escrowpaymentservice.model.PaymentRequest;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of the payment requests this agent tracks, keyed by blockchain identifier.
 * Nothing is persisted; the store starts empty with every process.
 */
@Repository
public class PaymentStore {

    private final Map<String, PaymentRequest> payments = new ConcurrentHashMap<>();

    public Optional<PaymentRequest> findById(String blockchainIdentifier) {
        return Optional.ofNullable(payments.get(blockchainIdentifier));
    }

    public boolean contains(String blockchainIdentifier) {
        return payments.containsKey(blockchainIdentifier);
    }

    public PaymentRequest save(String blockchainIdentifier, PaymentRequest payment) {
        payments.put(blockchainIdentifier, payment);
        return payment;
    }

    //Store keys, the entity's own identifier may be missing from a ledger answer
    public List<String> findNonTerminalIds() {
        return payments.entrySet().stream()
                .filter(entry -> !entry.getValue().isTerminal())
                .map(Map.Entry::getKey)
                .toList();
    }

    public Map<String, PaymentRequest> snapshot() {
        return Map.copyOf(payments);
    }

    public int removeTerminal() {
        int removed = 0;
        for (Map.Entry<String, PaymentRequest> entry : payments.entrySet()) {
            if (entry.getValue().isTerminal() && payments.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return payments.size();
    }

    public void clear() {
        payments.clear();
    }
}
