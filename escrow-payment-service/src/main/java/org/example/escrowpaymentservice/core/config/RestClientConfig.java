package org.example.escrowpaymentservice.core.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class RestClientConfig {

    static final String TOKEN_HEADER = "token";
    static final String SELLER_VKEY_HEADER = "X-Seller-Vkey";

    @Value("${app.ledger.api-key:}")
    private String apiKey;

    @Value("${app.agent.seller-vkey:}")
    private String sellerVkey;

    @Value("${app.ledger.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${app.ledger.read-timeout:30s}")
    private Duration readTimeout;

    @Bean
    public RestClient ledgerRestClient(@Value("${app.ledger.base-url}") String baseUrl) {
        return builder(baseUrl)
                .defaultHeaders(headers -> {
                    if (!sellerVkey.isBlank()) headers.set(SELLER_VKEY_HEADER, sellerVkey);
                })
                .build();
    }

    @Bean
    public RestClient registryRestClient(@Value("${app.registry.base-url:${app.ledger.base-url}}") String baseUrl) {
        return builder(baseUrl).build();
    }

    private RestClient.Builder builder(String baseUrl) {
        //Pinned to HTTP/1.1, some gateways in front of the ledger refuse the h2c upgrade
        var client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
        var requestFactory = new JdkClientHttpRequestFactory(client);
        requestFactory.setReadTimeout(readTimeout);

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .defaultHeaders(headers -> {
                    if (!apiKey.isBlank()) headers.set(TOKEN_HEADER, apiKey);
                });
    }

}
