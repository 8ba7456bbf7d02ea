package com.nosota.disbursement.submitter;

import com.nosota.disbursement.api.model.ChannelAccountState;
import com.nosota.disbursement.api.model.PaymentStatus;
import com.nosota.disbursement.config.TssProperties;
import com.nosota.disbursement.error.InvalidPaymentStatusTransitionException;
import com.nosota.disbursement.error.PaymentNotFoundException;
import com.nosota.disbursement.error.SignatureException;
import com.nosota.disbursement.error.UnsupportedSignatureOperationException;
import com.nosota.disbursement.ledger.LedgerClient;
import com.nosota.disbursement.ledger.LedgerException;
import com.nosota.disbursement.ledger.LedgerTransactionResult;
import com.nosota.disbursement.model.ChannelAccount;
import com.nosota.disbursement.model.Payment;
import com.nosota.disbursement.repository.ChannelAccountRepository;
import com.nosota.disbursement.repository.PaymentRepository;
import com.nosota.disbursement.service.PaymentService;
import com.nosota.disbursement.signing.SignatureService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Recovers from interrupted submissions (crash, kill, lost worker).
 *
 * <p>Everything older than the lease timeout is considered abandoned:
 * <ul>
 *   <li>LEASED channel accounts are released, or removed with their key when they were never
 *       activated on the ledger (creation interrupted before activation)</li>
 *   <li>PENDING_DELETION channel accounts are returned to the pool, or removed when the merge already
 *       happened on the ledger</li>
 *   <li>PENDING payments without a transaction hash go back to READY</li>
 *   <li>PENDING payments with a hash are reconciled against the ledger: a successful transaction
 *       finalizes SUCCESS, a failed one FAILED, an unknown one goes back to READY</li>
 * </ul>
 * Runs once when the application is ready, then on the lease sweep schedule.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaseReconciliationService {

    public record SweepResult(int releasedLeases, int removedUnactivated, int restoredDeletions, int removedDeletions,
                              int requeuedPayments, int succeededPayments, int failedPayments, int unresolvedPayments) {

        public int total() {
            return releasedLeases + removedUnactivated + restoredDeletions + removedDeletions
                    + requeuedPayments + succeededPayments + failedPayments;
        }
    }

    private final ChannelAccountRepository channelAccountRepository;
    private final PaymentRepository paymentRepository;
    private final PaymentService paymentService;
    private final LedgerClient ledgerClient;
    private final SignatureService signatureService;
    private final TssProperties tssProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void reconcileOnStartup() {
        try {
            SweepResult result = sweep();
            log.info("Startup lease reconciliation finished: {}", result);
        } catch (RuntimeException e) {
            log.error("Startup lease reconciliation failed: {}", e.getMessage(), e);
        }
    }

    public SweepResult sweep() {
        LocalDateTime staleBefore = LocalDateTime.now().minus(tssProperties.getSubmitter().getLeaseTimeout());

        // payments first: their ledger lookup must not race with a new lease of the same channel account
        int requeued = 0;
        int succeeded = 0;
        int failed = 0;
        int unresolved = 0;
        for (Payment payment : paymentRepository.findByStatusUpdatedBefore(PaymentStatus.PENDING, staleBefore)) {
            switch (reconcilePayment(payment)) {
                case REQUEUED -> requeued++;
                case SUCCESS -> succeeded++;
                case FAILED -> failed++;
                case UNRESOLVED -> unresolved++;
                default -> {
                }
            }
        }

        int released = 0;
        int removedUnactivated = 0;
        LocalDateTime now = LocalDateTime.now();
        for (ChannelAccount account : channelAccountRepository.findStale(ChannelAccountState.LEASED, staleBefore)) {
            String publicKey = account.getPublicKey();
            try {
                ledgerClient.getAccount(publicKey);
            } catch (LedgerException e) {
                if (e.isNotFound()) {
                    if (removeUnactivated(publicKey)) {
                        removedUnactivated++;
                    }
                } else {
                    log.warn("Cannot check abandoned channel account lease, retrying next sweep: " +
                            "publicKey={}, error={}", publicKey, e.getMessage());
                }
                continue;
            }
            if (channelAccountRepository.release(publicKey, now,
                    ChannelAccountState.LEASED, ChannelAccountState.FREE) > 0) {
                released++;
                log.warn("Released abandoned channel account lease: publicKey={}, leasedAt={}, paymentId={}",
                        publicKey, account.getLeasedAt(), account.getLeasedByPaymentId());
            }
        }

        int restored = 0;
        int removed = 0;
        for (ChannelAccount account : channelAccountRepository.findStale(ChannelAccountState.PENDING_DELETION, staleBefore)) {
            String publicKey = account.getPublicKey();
            try {
                ledgerClient.getAccount(publicKey);
                restored += channelAccountRepository.compareAndSetState(publicKey,
                        ChannelAccountState.PENDING_DELETION, ChannelAccountState.FREE, now);
                log.warn("Returned channel account with interrupted deletion to the pool: publicKey={}", publicKey);
            } catch (LedgerException e) {
                if (e.isNotFound()) {
                    removed += channelAccountRepository.deleteByPublicKeyAndState(publicKey, ChannelAccountState.PENDING_DELETION);
                    log.warn("Removed channel account already merged on ledger: publicKey={}", publicKey);
                } else {
                    log.warn("Cannot check channel account with interrupted deletion, retrying next sweep: " +
                            "publicKey={}, error={}", publicKey, e.getMessage());
                }
            }
        }

        return new SweepResult(released, removedUnactivated, restored, removed, requeued, succeeded, failed, unresolved);
    }

    /**
     * Removes a LEASED account that does not exist on the ledger, together with its stored key.
     */
    private boolean removeUnactivated(String publicKey) {
        if (channelAccountRepository.deleteByPublicKeyAndState(publicKey, ChannelAccountState.LEASED) == 0) {
            return false;
        }
        try {
            signatureService.getChannelAccountSigner().delete(publicKey);
        } catch (UnsupportedSignatureOperationException e) {
            log.debug("Channel account signer holds no key to delete: publicKey={}", publicKey);
        } catch (SignatureException e) {
            log.error("Failed to delete key of never activated channel account: publicKey={}, error={}",
                    publicKey, e.getMessage());
        }
        log.warn("Removed channel account that was never activated on ledger: publicKey={}", publicKey);
        return true;
    }

    private SubmissionOutcome reconcilePayment(Payment payment) {
        String hash = payment.getLedgerTransactionHash();
        try {
            if (hash == null) {
                paymentService.requeue(payment.getId(), "reclaimed by lease sweep", null);
                return SubmissionOutcome.REQUEUED;
            }

            LedgerTransactionResult result;
            try {
                result = ledgerClient.getTransaction(hash);
            } catch (LedgerException e) {
                if (!e.isNotFound()) {
                    log.warn("Cannot look up transaction of abandoned payment, retrying next sweep: " +
                            "paymentId={}, hash={}, error={}", payment.getId(), hash, e.getMessage());
                    return SubmissionOutcome.UNRESOLVED;
                }
                paymentService.requeue(payment.getId(), "reclaimed by lease sweep, transaction not on ledger", null);
                return SubmissionOutcome.REQUEUED;
            }

            if (result.successful()) {
                paymentService.markSuccess(payment.getId(), hash);
                log.info("Abandoned payment confirmed on ledger: paymentId={}, hash={}", payment.getId(), hash);
                return SubmissionOutcome.SUCCESS;
            }
            String classification = result.operationResultCodes() != null && !result.operationResultCodes().isEmpty()
                    ? String.join(",", result.operationResultCodes())
                    : result.resultCode();
            paymentService.markFailed(payment.getId(), "transaction failed on ledger: " + classification, classification);
            log.error("Abandoned payment failed on ledger: paymentId={}, hash={}, classification={}",
                    payment.getId(), hash, classification);
            return SubmissionOutcome.FAILED;
        } catch (PaymentNotFoundException | InvalidPaymentStatusTransitionException e) {
            log.warn("Abandoned payment changed during reconciliation: paymentId={}, error={}",
                    payment.getId(), e.getMessage());
            return SubmissionOutcome.ABORTED;
        }
    }
}
