package org.example.escrowpaymentservice.core.event;

import lombok.extern.slf4j.Slf4j;
import org.example.escrowpaymentservice.dto.event.RegistryErrorEvent;
import org.example.escrowpaymentservice.dto.event.RegistryEvent;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class RegistryEventLogger implements RegistryEventListener {

    @Override
    public void onEvent(RegistryEvent event) {
        if (event instanceof RegistryErrorEvent error) {
            log.warn("registry_error during {}: {}", error.operation(), error.cause().getMessage());
        } else {
            log.debug("{}", event);
        }
    }
}
