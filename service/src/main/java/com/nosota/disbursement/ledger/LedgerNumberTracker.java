package com.nosota.disbursement.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Caches the latest ledger sequence number.
 *
 * <p>Every built transaction carries a max ledger bound of {@code current + INCREMENT_FOR_MAX_LEDGER_BOUNDS};
 * the same value bounds the channel account lease. The cached value is refreshed once it is older than
 * {@link #MAX_LEDGER_AGE}, so a bound is never computed from a stale ledger number.
 */
@Component
@Slf4j
public class LedgerNumberTracker {

    /**
     * Ledgers added to the current ledger to get a transaction's max ledger bound.
     */
    public static final long INCREMENT_FOR_MAX_LEDGER_BOUNDS = 10;

    /**
     * Age after which the cached ledger number is refreshed.
     */
    public static final Duration MAX_LEDGER_AGE = Duration.ofSeconds(5);

    private final LedgerClient ledgerClient;
    private final Clock clock;

    private long ledgerNumber;
    private Instant fetchedAt;

    @Autowired
    public LedgerNumberTracker(LedgerClient ledgerClient) {
        this(ledgerClient, Clock.systemUTC());
    }

    LedgerNumberTracker(LedgerClient ledgerClient, Clock clock) {
        this.ledgerClient = ledgerClient;
        this.clock = clock;
    }

    /**
     * @return Latest ledger number, at most {@link #MAX_LEDGER_AGE} old
     */
    public synchronized long getLedgerNumber() throws LedgerException {
        Instant now = clock.instant();
        if (fetchedAt == null || Duration.between(fetchedAt, now).compareTo(MAX_LEDGER_AGE) >= 0) {
            ledgerNumber = ledgerClient.getLatestLedgerSequence();
            fetchedAt = now;
            log.debug("Refreshed ledger number: ledger={}", ledgerNumber);
        }
        return ledgerNumber;
    }

    /**
     * @return Last ledger on which a transaction built now may be included
     */
    public long getMaxLedgerBound() throws LedgerException {
        return getLedgerNumber() + INCREMENT_FOR_MAX_LEDGER_BOUNDS;
    }
}
