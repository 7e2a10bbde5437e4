package org.example.escrowpaymentservice.client.registry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

//Registry endpoints wrap their payload in a "data" envelope
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistryResponse<T>(
        String status,
        T data
) {
}
