package com.nosota.disbursement.scheduler;

import com.nosota.disbursement.service.ReadyPaymentsCancellationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cancels READY payments older than their tenant's cancellation period.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   ready-payments-cancellation:
 *     enabled: true                # enable/disable scheduler
 *     cron: "0 0 * * * *"         # every hour
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.ready-payments-cancellation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ReadyPaymentsCancellationScheduler {

    private final ReadyPaymentsCancellationService readyPaymentsCancellationService;

    @Scheduled(cron = "${scheduler.ready-payments-cancellation.cron:0 0 * * * *}")
    public void cancelExpiredReadyPayments() {
        log.info("Starting scheduled job: cancel expired READY payments");

        try {
            int canceledCount = readyPaymentsCancellationService.cancelExpiredReadyPayments();

            if (canceledCount > 0) {
                log.info("Canceled {} expired READY payments", canceledCount);
            } else {
                log.debug("No expired READY payments found");
            }

        } catch (Exception e) {
            log.error("Failed to cancel expired READY payments: {}", e.getMessage(), e);
        }
    }
}
