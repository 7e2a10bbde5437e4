package org.example.escrowpaymentservice.client.ledger;

import org.example.escrowpaymentservice.client.ledger.dto.CreatePaymentPayload;
import org.example.escrowpaymentservice.client.ledger.dto.ListPaymentsQuery;
import org.example.escrowpaymentservice.client.ledger.dto.PaymentListResponse;
import org.example.escrowpaymentservice.client.ledger.dto.PaymentReferencePayload;
import org.example.escrowpaymentservice.client.ledger.dto.SubmitResultPayload;
import org.example.escrowpaymentservice.model.Network;
import org.example.escrowpaymentservice.model.PaymentRequest;
import org.example.escrowpaymentservice.model.WalletBalance;

/**
 * Contract of the remote escrow ledger. All methods throw
 * {@link org.example.escrowpaymentservice.core.exception.LedgerTransportException} when the call
 * does not produce a usable response.
 */
public interface LedgerClient {

    /**
     * Registers a new payment request.
     *
     * @param payload request parameters, carrying the input hash only
     * @return the payment with its assigned blockchain identifier
     */
    PaymentRequest createPayment(CreatePaymentPayload payload);

    /**
     * Fetches the current state of a payment.
     *
     * @param payload identifier and network of the payment
     * @return the payment with its current on-chain state
     */
    PaymentRequest resolvePayment(PaymentReferencePayload payload);

    /**
     * Submits the hash of the work result.
     *
     * @param payload identifier, network and result hash
     * @return the updated payment
     */
    PaymentRequest submitResult(SubmitResultPayload payload);

    /**
     * Authorizes the buyer to withdraw a refund.
     *
     * @param payload identifier and network of the payment
     * @return the updated payment
     */
    PaymentRequest authorizeRefund(PaymentReferencePayload payload);

    PaymentListResponse listPayments(ListPaymentsQuery query);

    WalletBalance getWalletBalance(Network network);
}
