package com.nosota.disbursement.submitter;

import com.nosota.disbursement.config.TssProperties;
import com.nosota.disbursement.dto.ResolvedDistributionAccount;
import com.nosota.disbursement.error.DistributionAccountNotFoundException;
import com.nosota.disbursement.error.InvalidPaymentStatusTransitionException;
import com.nosota.disbursement.error.PaymentNotFoundException;
import com.nosota.disbursement.error.SignatureException;
import com.nosota.disbursement.error.TenantNotFoundException;
import com.nosota.disbursement.ledger.LedgerClient;
import com.nosota.disbursement.ledger.LedgerException;
import com.nosota.disbursement.ledger.LedgerNumberTracker;
import com.nosota.disbursement.ledger.LedgerAccount;
import com.nosota.disbursement.ledger.LedgerTransactionResult;
import com.nosota.disbursement.ledger.LedgerTransactions;
import com.nosota.disbursement.model.ChannelAccount;
import com.nosota.disbursement.model.Payment;
import com.nosota.disbursement.service.ChannelAccountLeaseService;
import com.nosota.disbursement.service.DistributionAccountResolver;
import com.nosota.disbursement.service.PaymentService;
import com.nosota.disbursement.signing.SignatureClient;
import com.nosota.disbursement.signing.SignatureService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.stellar.sdk.AssetCodeLengthInvalidException;
import org.stellar.sdk.FormatException;
import org.stellar.sdk.Transaction;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Processes one claimed (PENDING) payment: lease, build, sign, submit, resolve the outcome, release.
 *
 * <p>Outcome rules:
 * <ul>
 *   <li>confirmed: SUCCESS with the transaction hash</li>
 *   <li>permanent rejection: FAILED with the rejection classification</li>
 *   <li>transient error: READY, or FAILED once the attempt budget is used</li>
 *   <li>no free channel account within the lease wait: READY, no attempt consumed</li>
 *   <li>indeterminate response: the ledger is polled until the transaction is found or its max ledger bound
 *       has passed; if neither happens in time the payment stays PENDING for the lease sweep</li>
 * </ul>
 * The channel account is released exactly once, whatever the outcome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionWorker {

    private static final Duration LEASE_POLL_INTERVAL = Duration.ofMillis(200);

    private final PaymentService paymentService;
    private final ChannelAccountLeaseService leaseService;
    private final DistributionAccountResolver distributionAccountResolver;
    private final SignatureService signatureService;
    private final LedgerClient ledgerClient;
    private final LedgerNumberTracker ledgerNumberTracker;
    private final TransactionProcessingLimiter limiter;
    private final TssProperties tssProperties;

    public SubmissionOutcome process(Payment payment) {
        UUID paymentId = payment.getId();

        // 1. Funding account and its signer
        ResolvedDistributionAccount distributionAccount;
        SignatureClient distributionSigner;
        try {
            distributionAccount = distributionAccountResolver.resolve(payment.getTenantId());
            distributionSigner = signatureService.distributionAccountSigner(distributionAccount.type());
        } catch (TenantNotFoundException | DistributionAccountNotFoundException | SignatureException e) {
            log.error("Cannot resolve distribution account for payment: paymentId={}, tenantId={}, error={}",
                    paymentId, payment.getTenantId(), e.getMessage());
            return fail(paymentId, e.getMessage(), "distribution_account_unavailable");
        }

        // 2. Ledger bound shared by the lease and the transaction
        long currentLedger;
        try {
            currentLedger = ledgerNumberTracker.getLedgerNumber();
        } catch (LedgerException e) {
            return requeueAfterPreparationError(paymentId, e, "load ledger number");
        }
        long maxLedger = currentLedger + LedgerNumberTracker.INCREMENT_FOR_MAX_LEDGER_BOUNDS;

        // 3. Pair with a channel account
        Optional<ChannelAccount> lease = leaseWithWait(paymentId, currentLedger, maxLedger);
        if (lease.isEmpty()) {
            log.debug("No free channel account for payment: paymentId={}", paymentId);
            return requeue(paymentId, "no channel account available", null);
        }

        String channelAccount = lease.get().getPublicKey();
        try {
            return submit(payment, channelAccount, distributionAccount, distributionSigner, maxLedger);
        } finally {
            leaseService.release(channelAccount, paymentId);
        }
    }

    private SubmissionOutcome submit(Payment payment,
                                     String channelAccount,
                                     ResolvedDistributionAccount distributionAccount,
                                     SignatureClient distributionSigner,
                                     long maxLedger) {
        UUID paymentId = payment.getId();

        // 4. Build with a fresh sequence number of the channel account
        LedgerAccount source;
        try {
            source = ledgerClient.getAccount(channelAccount);
        } catch (LedgerException e) {
            if (e.isNotFound()) {
                log.error("Channel account missing on ledger, verify the pool: channelAccount={}", channelAccount);
            }
            return requeueAfterPreparationError(paymentId, e, "load channel account " + channelAccount);
        }

        Transaction transaction;
        String hash;
        try {
            transaction = LedgerTransactions.builder(
                            signatureService.getNetwork(),
                            source,
                            tssProperties.getMaxBaseFee(),
                            Instant.now().plus(tssProperties.getTransactionTimeout()).getEpochSecond(),
                            maxLedger)
                    .addOperation(LedgerTransactions.payment(
                            distributionAccount.address(),
                            payment.getDestination(),
                            payment.getAssetCode(),
                            payment.isNativeAsset() ? null : payment.getAssetIssuer(),
                            payment.getAmount()))
                    .build();
            hash = transaction.hashHex();
        } catch (FormatException | AssetCodeLengthInvalidException | IllegalArgumentException e) {
            log.error("Payment cannot be expressed as a ledger transaction: paymentId={}, error={}",
                    paymentId, e.getMessage());
            return fail(paymentId, "malformed transaction: " + e.getMessage(), "malformed_transaction");
        }

        // 5. Record the attempt and the hash before anything leaves the process
        int attempts;
        try {
            attempts = paymentService.recordSubmissionAttempt(paymentId, channelAccount, hash).getSubmissionAttempts();
        } catch (PaymentNotFoundException | InvalidPaymentStatusTransitionException e) {
            log.warn("Payment no longer pending, submission aborted: paymentId={}, reason={}", paymentId, e.getMessage());
            return SubmissionOutcome.ABORTED;
        }

        // 6. Sign: channel account as transaction source, distribution account for the payment operation
        Transaction signed;
        try {
            signed = signatureService.getChannelAccountSigner().sign(transaction, channelAccount);
            signed = distributionSigner.sign(signed, distributionAccount.address());
        } catch (SignatureException e) {
            log.error("Failed to sign transaction: paymentId={}, channelAccount={}, distributionAccountType={}, error={}",
                    paymentId, channelAccount, distributionAccount.type(), e.getMessage());
            return requeueOrFail(paymentId, attempts, "signing failed: " + e.getMessage(), "signature_error");
        }

        // 7. Submit and resolve
        try {
            LedgerTransactionResult result = ledgerClient.submitTransaction(signed);
            log.info("Payment submitted: paymentId={}, channelAccount={}, hash={}, ledger={}",
                    paymentId, channelAccount, hash, result.ledger());
            return succeed(paymentId, hash);
        } catch (LedgerException e) {
            return handleSubmissionError(paymentId, attempts, hash, maxLedger, channelAccount, distributionAccount, e);
        }
    }

    private SubmissionOutcome handleSubmissionError(UUID paymentId,
                                                    int attempts,
                                                    String hash,
                                                    long maxLedger,
                                                    String channelAccount,
                                                    ResolvedDistributionAccount distributionAccount,
                                                    LedgerException error) {
        String classification = error.classification();

        if (error.isPermanentRejection()) {
            log.error("Payment rejected by ledger: paymentId={}, channelAccount={}, distributionAccount={}, " +
                            "distributionAccountType={}, classification={}",
                    paymentId, channelAccount, distributionAccount.address(), distributionAccount.type(), classification);
            return fail(paymentId, "rejected by ledger: " + classification, classification);
        }

        if (error.hasResultCodes()) {
            // nothing was applied, a new transaction with a fresh sequence number is safe
            log.warn("Transient ledger rejection: paymentId={}, channelAccount={}, classification={}, attempt={}",
                    paymentId, channelAccount, classification, attempts);
            return requeueOrFail(paymentId, attempts, "transient ledger error: " + classification, classification);
        }

        limiter.recordIndeterminateResponse();
        log.warn("Indeterminate submission response, looking up transaction: paymentId={}, hash={}, error={}",
                paymentId, hash, error.getMessage());

        Optional<LedgerTransactionResult> outcome;
        try {
            outcome = awaitOutcome(hash, maxLedger);
        } catch (LedgerException e) {
            log.warn("Outcome still unknown, payment left pending for the lease sweep: paymentId={}, hash={}, error={}",
                    paymentId, hash, e.getMessage());
            return SubmissionOutcome.UNRESOLVED;
        }

        if (outcome.isEmpty()) {
            return requeueOrFail(paymentId, attempts, "transaction not included: " + classification, classification);
        }
        LedgerTransactionResult result = outcome.get();
        if (result.successful()) {
            return succeed(paymentId, hash);
        }
        return handleSubmissionError(paymentId, attempts, hash, maxLedger, channelAccount, distributionAccount,
                new LedgerException("Transaction " + hash + " failed on ledger", 400,
                        result.resultCode() == null ? "tx_failed" : result.resultCode(),
                        result.operationResultCodes()));
    }

    /**
     * Polls the ledger for the transaction until it is found or the ledger has passed the transaction's
     * max ledger bound (it can no longer be included).
     *
     * @return The included transaction, or empty when it can no longer be included
     * @throws LedgerException when neither is known before the submission timeout or the ledger cannot be reached
     */
    private Optional<LedgerTransactionResult> awaitOutcome(String hash, long maxLedger) throws LedgerException {
        Duration timeout = tssProperties.getSubmitter().getSubmissionTimeout();
        Instant deadline = Instant.now().plus(timeout);
        LedgerException lastError = null;

        while (true) {
            try {
                return Optional.of(ledgerClient.getTransaction(hash));
            } catch (LedgerException e) {
                if (!e.isNotFound()) {
                    lastError = e;
                } else if (ledgerClient.getLatestLedgerSequence() > maxLedger) {
                    // bound passed: one more lookup covers an inclusion in the last valid ledger
                    try {
                        return Optional.of(ledgerClient.getTransaction(hash));
                    } catch (LedgerException lastLookup) {
                        if (lastLookup.isNotFound()) {
                            return Optional.empty();
                        }
                        lastError = lastLookup;
                    }
                }
            }

            if (!Instant.now().isBefore(deadline)) {
                throw lastError != null ? lastError
                        : new LedgerException("Transaction " + hash + " not found within " + timeout, 504);
            }
            try {
                Thread.sleep(tssProperties.getSubmitter().getConfirmationPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LedgerException("Interrupted while looking up transaction " + hash, e);
            }
        }
    }

    private Optional<ChannelAccount> leaseWithWait(UUID paymentId, long currentLedger, long maxLedger) {
        Instant deadline = Instant.now().plus(tssProperties.getSubmitter().getLeaseWaitTimeout());
        while (true) {
            Optional<ChannelAccount> lease = leaseService.tryLease(paymentId, currentLedger, maxLedger);
            if (lease.isPresent() || !Instant.now().isBefore(deadline)) {
                return lease;
            }
            try {
                Thread.sleep(LEASE_POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    // ==================== Status updates ====================

    private SubmissionOutcome requeueAfterPreparationError(UUID paymentId, LedgerException e, String step) {
        if (!e.hasResultCodes()) {
            limiter.recordIndeterminateResponse();
        }
        log.warn("Ledger error before submission, payment requeued: paymentId={}, step={}, error={}",
                paymentId, step, e.getMessage());
        return requeue(paymentId, "ledger unavailable: " + e.classification(), e.classification());
    }

    private SubmissionOutcome requeueOrFail(UUID paymentId, int attempts, String message, String classification) {
        int maxAttempts = tssProperties.getSubmitter().getMaxAttempts();
        if (attempts >= maxAttempts) {
            log.error("Payment out of submission attempts: paymentId={}, attempts={}, classification={}",
                    paymentId, attempts, classification);
            return fail(paymentId, String.format("%s (%d of %d attempts used)", message, attempts, maxAttempts),
                    classification);
        }
        return requeue(paymentId, message, classification);
    }

    private SubmissionOutcome succeed(UUID paymentId, String hash) {
        try {
            paymentService.markSuccess(paymentId, hash);
            return SubmissionOutcome.SUCCESS;
        } catch (PaymentNotFoundException | InvalidPaymentStatusTransitionException e) {
            log.error("Transaction confirmed on ledger but payment could not be marked SUCCESS: paymentId={}, hash={}, error={}",
                    paymentId, hash, e.getMessage());
            return SubmissionOutcome.ABORTED;
        }
    }

    private SubmissionOutcome fail(UUID paymentId, String message, String classification) {
        try {
            paymentService.markFailed(paymentId, message, classification);
            return SubmissionOutcome.FAILED;
        } catch (PaymentNotFoundException | InvalidPaymentStatusTransitionException e) {
            log.warn("Payment could not be marked FAILED: paymentId={}, error={}", paymentId, e.getMessage());
            return SubmissionOutcome.ABORTED;
        }
    }

    private SubmissionOutcome requeue(UUID paymentId, String message, String classification) {
        try {
            paymentService.requeue(paymentId, message, classification);
            return SubmissionOutcome.REQUEUED;
        } catch (PaymentNotFoundException | InvalidPaymentStatusTransitionException e) {
            log.warn("Payment could not be requeued: paymentId={}, error={}", paymentId, e.getMessage());
            return SubmissionOutcome.ABORTED;
        }
    }
}
