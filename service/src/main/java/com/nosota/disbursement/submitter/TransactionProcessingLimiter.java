package com.nosota.disbursement.submitter;

import com.nosota.disbursement.config.TssProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Adapts the claim size to the health of the ledger.
 *
 * <p>Every indeterminate ledger response (timeout, gateway error, network failure) is counted. Once the
 * count reaches the tolerance, the claim limit drops to the downsized value for the downsize window and
 * the count starts over. Outside a window the configured batch size applies.
 */
@Component
@Slf4j
public class TransactionProcessingLimiter {

    private final int batchSize;
    private final int downsizedBatchSize;
    private final int tolerance;
    private final Duration downsizeWindow;
    private final Clock clock;

    private int indeterminateResponses;
    private Instant downsizedUntil;

    @Autowired
    public TransactionProcessingLimiter(TssProperties tssProperties) {
        this(tssProperties.getSubmitter(), Clock.systemUTC());
    }

    TransactionProcessingLimiter(TssProperties.Submitter submitter, Clock clock) {
        this.batchSize = submitter.getBatchSize();
        this.downsizedBatchSize = Math.min(submitter.getDownsizedBatchSize(), submitter.getBatchSize());
        this.tolerance = submitter.getIndeterminateResponsesTolerance();
        this.downsizeWindow = submitter.getDownsizeWindow();
        this.clock = clock;
    }

    public synchronized void recordIndeterminateResponse() {
        indeterminateResponses++;
        if (indeterminateResponses >= tolerance) {
            downsizedUntil = clock.instant().plus(downsizeWindow);
            indeterminateResponses = 0;
            log.warn("Too many indeterminate ledger responses, reducing claim size: limit={}, until={}",
                    downsizedBatchSize, downsizedUntil);
        }
    }

    /**
     * @return Maximum number of payments to claim in the next round
     */
    public synchronized int getLimit() {
        if (downsizedUntil != null) {
            if (clock.instant().isBefore(downsizedUntil)) {
                return downsizedBatchSize;
            }
            downsizedUntil = null;
            log.info("Claim size restored: limit={}", batchSize);
        }
        return batchSize;
    }

    public synchronized int getIndeterminateResponses() {
        return indeterminateResponses;
    }
}
