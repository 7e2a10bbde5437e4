package org.example.escrowpaymentservice.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.example.escrowpaymentservice.dto.event.MonitorErrorEvent;
import org.example.escrowpaymentservice.repository.PaymentStore;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Periodic reconciliation of every non-terminal payment in the store. At most one task is
 * scheduled at a time; a failed refresh is reported and the cycle moves on to the next payment.
 * Failed payments are retried on the next cycle, at the same cadence as the others.
 */
@Slf4j
public class PaymentMonitorScheduler {

    private final TaskScheduler taskScheduler;
    private final PaymentStore paymentStore;
    private final Consumer<String> refresher;
    private final Consumer<MonitorErrorEvent> errorSink;
    private final Clock clock;

    private ScheduledFuture<?> scheduledTask;

    public PaymentMonitorScheduler(TaskScheduler taskScheduler, PaymentStore paymentStore,
                                   Consumer<String> refresher, Consumer<MonitorErrorEvent> errorSink,
                                   Clock clock) {
        this.taskScheduler = taskScheduler;
        this.paymentStore = paymentStore;
        this.refresher = refresher;
        this.errorSink = errorSink;
        this.clock = clock;
    }

    /**
     * @return false when monitoring was already running and nothing was scheduled
     */
    public synchronized boolean start(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Monitoring interval must be positive, got " + interval);
        }
        if (scheduledTask != null) {
            log.warn("Payment monitoring already running");
            return false;
        }

        scheduledTask = taskScheduler.scheduleWithFixedDelay(this::runCycle, clock.instant().plus(interval), interval);
        log.info("Payment status monitoring started (interval {})", interval);
        return true;
    }

    public synchronized void stop() {
        if (scheduledTask == null) return;

        scheduledTask.cancel(false);
        scheduledTask = null;
        log.info("Payment status monitoring stopped");
    }

    public synchronized boolean isRunning() {
        return scheduledTask != null;
    }

    /**
     * Refreshes each non-terminal payment once, in sequence.
     *
     * @return number of payments that failed to refresh
     */
    public int runCycle() {
        List<String> due = paymentStore.findNonTerminalIds();

        if (due.isEmpty()) return 0;

        log.debug("Reconciling {} tracked payment(s)", due.size());
        int failures = 0;

        for (String blockchainIdentifier : due) {
            try {
                //Cleaned up or dropped by close() since the snapshot was taken
                if (!paymentStore.contains(blockchainIdentifier)) continue;

                refresher.accept(blockchainIdentifier);
            } catch (Exception e) {
                failures++;
                log.error("Payment status check failed for {}", blockchainIdentifier, e);
                errorSink.accept(new MonitorErrorEvent(blockchainIdentifier, e));
            }
        }

        if (failures > 0) {
            log.warn("Reconciliation cycle finished with {} failure(s) out of {} payment(s)", failures, due.size());
        }
        return failures;
    }
}
