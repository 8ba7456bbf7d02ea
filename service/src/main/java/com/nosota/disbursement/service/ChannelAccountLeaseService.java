package com.nosota.disbursement.service;

import com.nosota.disbursement.api.model.ChannelAccountState;
import com.nosota.disbursement.model.ChannelAccount;
import com.nosota.disbursement.repository.ChannelAccountRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lease and release of channel accounts for submission.
 *
 * <p>A lease is a conditional update of a FREE row (or of a LEASED row whose ledger lock has ended) picked
 * with {@code FOR UPDATE SKIP LOCKED}, a release a conditional update of a row leased for the same payment.
 * Both are safe across processes, and releasing an account that is not leased for the payment is a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChannelAccountLeaseService {

    private final ChannelAccountRepository channelAccountRepository;

    /**
     * Leases any free channel account, or one whose previous lease is locked to a ledger that has
     * already closed.
     *
     * @param paymentId         Payment the account is leased for
     * @param currentLedger     Latest ledger number
     * @param lockedUntilLedger Max ledger bound of the transaction that will use the account
     * @return The leased account, empty when no account is leasable
     */
    @Transactional
    public Optional<ChannelAccount> tryLease(UUID paymentId, long currentLedger, long lockedUntilLedger) {
        List<ChannelAccount> candidates = channelAccountRepository.findLeasableForUpdateSkipLocked(currentLedger, 1);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        ChannelAccount account = candidates.get(0);
        LocalDateTime now = LocalDateTime.now();
        if (account.isLeased()) {
            log.warn("Taking over channel account with expired ledger lock: publicKey={}, lockedUntilLedger={}, " +
                            "previousPaymentId={}", account.getPublicKey(), account.getLockedUntilLedgerNumber(),
                    account.getLeasedByPaymentId());
        }
        int leased = channelAccountRepository.lease(account.getPublicKey(), currentLedger, lockedUntilLedger,
                paymentId, now,
                ChannelAccountState.LEASED, ChannelAccountState.FREE);
        if (leased == 0) {
            return Optional.empty();
        }

        account.setState(ChannelAccountState.LEASED);
        account.setLeasedAt(now);
        account.setLockedUntilLedgerNumber(lockedUntilLedger);
        account.setLeasedByPaymentId(paymentId);
        account.setUpdatedAt(now);

        log.debug("Leased channel account: publicKey={}, paymentId={}, lockedUntilLedger={}",
                account.getPublicKey(), paymentId, lockedUntilLedger);
        return Optional.of(account);
    }

    /**
     * Returns an account leased for {@code paymentId} to the pool.
     *
     * @return true if the account was leased for the payment and is now free, false if there was nothing
     *         to release (already released, or the lease was taken over after its ledger lock ended)
     */
    public boolean release(String publicKey, UUID paymentId) {
        int released = channelAccountRepository.releaseLease(publicKey, paymentId, LocalDateTime.now(),
                ChannelAccountState.LEASED, ChannelAccountState.FREE);
        if (released == 0) {
            log.debug("Channel account not leased for payment, nothing to release: publicKey={}, paymentId={}",
                    publicKey, paymentId);
            return false;
        }
        log.debug("Released channel account: publicKey={}", publicKey);
        return true;
    }
}
