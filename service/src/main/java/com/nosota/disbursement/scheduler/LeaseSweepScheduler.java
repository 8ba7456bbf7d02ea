package com.nosota.disbursement.scheduler;

import com.nosota.disbursement.submitter.LeaseReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic sweep of abandoned channel account leases and PENDING payments.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   lease-sweep:
 *     enabled: true            # enable/disable scheduler
 *     cron: "0 * * * * *"      # every minute
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.lease-sweep.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class LeaseSweepScheduler {

    private final LeaseReconciliationService leaseReconciliationService;

    @Scheduled(cron = "${scheduler.lease-sweep.cron:0 * * * * *}")
    public void sweepAbandonedLeases() {
        log.debug("Starting scheduled job: lease sweep");

        try {
            LeaseReconciliationService.SweepResult result = leaseReconciliationService.sweep();

            if (result.total() > 0 || result.unresolvedPayments() > 0) {
                log.info("Lease sweep reconciled abandoned work: {}", result);
            } else {
                log.debug("No abandoned leases found");
            }

        } catch (Exception e) {
            log.error("Lease sweep failed: {}", e.getMessage(), e);
        }
    }
}
