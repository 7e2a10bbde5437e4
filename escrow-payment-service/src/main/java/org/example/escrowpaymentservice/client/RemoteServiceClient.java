package org.example.escrowpaymentservice.client;

import lombok.extern.slf4j.Slf4j;
import org.example.escrowpaymentservice.core.exception.LedgerTransportException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.function.Supplier;

/**
 * Shared plumbing for the escrow service endpoints. Every failure of the underlying
 * {@link RestClient} surfaces as a {@link LedgerTransportException}; nothing is retried here.
 */
@Slf4j
public abstract class RemoteServiceClient {

    protected final RestClient restClient;

    protected RemoteServiceClient(RestClient restClient) {
        this.restClient = restClient;
    }

    protected <T> T call(String operation, Supplier<T> request) {
        T body;
        try {
            body = request.get();
        } catch (RestClientResponseException e) {
            log.warn("{} rejected with HTTP {}", operation, e.getStatusCode().value());
            throw new LedgerTransportException(operation, e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            log.warn("{} failed: {}", operation, e.getMessage());
            throw new LedgerTransportException(operation + " failed: " + e.getMessage(), e);
        }

        if (body == null) {
            throw new LedgerTransportException(operation + " returned an empty body", null);
        }
        return body;
    }
}
