package org.example.escrowpaymentservice.core.exception;

import java.util.OptionalInt;

/**
 * A call to the remote ledger did not produce a usable response: the connection failed,
 * the service answered with a non-2xx status, or the body could not be read.
 */
public class LedgerTransportException extends RuntimeException {

    private final Integer statusCode;

    public LedgerTransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public LedgerTransportException(String operation, int statusCode, String responseBody, Throwable cause) {
        super(operation + " failed with HTTP " + statusCode + ": " + responseBody, cause);
        this.statusCode = statusCode;
    }

    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
