package org.example.escrowpaymentservice.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.escrowpaymentservice.service.PaymentLifecycleService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "app.monitor.auto-start", havingValue = "true")
public class MonitorAutoStarter {

    private final PaymentLifecycleService paymentLifecycleService;

    @EventListener(ApplicationReadyEvent.class)
    public void startMonitoring() {
        log.info("Auto-starting payment status monitoring");
        paymentLifecycleService.startMonitoring();
    }
}
