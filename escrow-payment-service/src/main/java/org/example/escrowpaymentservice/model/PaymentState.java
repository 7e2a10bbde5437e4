package org.example.escrowpaymentservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * On-chain states reported by the escrow ledger. A payment with no state yet is
 * considered pending and is represented by {@code null}.
 * <p>
 * States this service does not know (the ledger adds dispute and refund-request states over
 * time) read as {@link #UNKNOWN}, which is not terminal, so the payment stays polled.
 */
public enum PaymentState {
    WAITING_FOR_EXTERNAL_ACTION("WaitingForExternalAction", false),
    FUNDS_LOCKED("FundsLocked", false),
    RESULT_SUBMITTED("ResultSubmitted", false),
    WITHDRAWN("Withdrawn", true),
    REFUND_WITHDRAWN("RefundWithdrawn", true),
    DISPUTED_WITHDRAWN("DisputedWithdrawn", true),
    UNKNOWN("Unknown", false);

    private final String wireName;
    private final boolean terminal;

    PaymentState(String wireName, boolean terminal) {
        this.wireName = wireName;
        this.terminal = terminal;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public static boolean isTerminal(PaymentState state) {
        return state != null && state.terminal;
    }

    @JsonCreator
    public static PaymentState fromWireName(String value) {
        if (value == null) return null;

        return Arrays.stream(values())
                .filter(state -> state.wireName.equals(value))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
