package com.nosota.disbursement.scheduler;

import com.nosota.disbursement.api.response.ChannelAccountVerificationResponse;
import com.nosota.disbursement.service.ChannelAccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cross-checks the channel account pool against the ledger.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   channel-account-verification:
 *     enabled: true                 # enable/disable scheduler
 *     cron: "0 0 3 * * *"           # every day at 03:00
 *     prune-invalid: false          # remove accounts missing on the ledger
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.channel-account-verification.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ChannelAccountVerificationScheduler {

    private final ChannelAccountService channelAccountService;

    @Value("${scheduler.channel-account-verification.prune-invalid:false}")
    private boolean pruneInvalid;

    @Scheduled(cron = "${scheduler.channel-account-verification.cron:0 0 3 * * *}")
    public void verifyChannelAccounts() {
        log.info("Starting scheduled job: channel account verification (pruneInvalid={})", pruneInvalid);

        try {
            ChannelAccountVerificationResponse result = channelAccountService.verifyChannelAccounts(pruneInvalid);

            if (result.invalid().isEmpty()) {
                log.info("All {} channel accounts exist on the ledger", result.checked());
            } else {
                log.warn("Channel accounts missing on the ledger: invalid={}, pruned={}, skipped={}",
                        result.invalid(), result.pruned(), result.skipped());
            }

        } catch (Exception e) {
            log.error("Failed to verify channel accounts: {}", e.getMessage(), e);
        }
    }
}
