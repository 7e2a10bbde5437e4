package org.example.escrowpaymentservice.core.exception;

public class UnknownPaymentException extends RuntimeException {

    private final String blockchainIdentifier;

    public UnknownPaymentException(String blockchainIdentifier) {
        super("Payment not found: " + blockchainIdentifier
                + ". Refresh its status first or create it through this engine.");
        this.blockchainIdentifier = blockchainIdentifier;
    }

    public String getBlockchainIdentifier() {
        return blockchainIdentifier;
    }
}
