package org.example.escrowpaymentservice.core.event;

import lombok.extern.slf4j.Slf4j;
import org.example.escrowpaymentservice.dto.event.MonitorErrorEvent;
import org.example.escrowpaymentservice.dto.event.PaymentEvent;
import org.example.escrowpaymentservice.dto.event.PaymentStateChangedEvent;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class PaymentEventLogger implements PaymentEventListener {

    @Override
    public void onEvent(PaymentEvent event) {
        if (event instanceof MonitorErrorEvent error) {
            log.warn("monitor_error for {}: {}", error.blockchainIdentifier(), error.cause().getMessage());
        } else if (event instanceof PaymentStateChangedEvent change) {
            log.debug("state_changed {}: {} -> {}", change.blockchainIdentifier(), change.previousState(), change.newState());
        } else {
            log.debug("{} for {}", event.getClass().getSimpleName(), event.blockchainIdentifier());
        }
    }
}
