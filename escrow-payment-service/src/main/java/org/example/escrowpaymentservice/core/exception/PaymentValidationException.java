package org.example.escrowpaymentservice.core.exception;

public class PaymentValidationException extends RuntimeException {
    public PaymentValidationException(String msg) {super(msg);}
}
