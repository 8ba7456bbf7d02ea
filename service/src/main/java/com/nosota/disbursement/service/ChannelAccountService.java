package com.nosota.disbursement.service;

import com.nosota.disbursement.api.dto.ChannelAccountDTO;
import com.nosota.disbursement.api.model.ChannelAccountState;
import com.nosota.disbursement.api.response.ChannelAccountPoolResponse;
import com.nosota.disbursement.api.response.ChannelAccountVerificationResponse;
import com.nosota.disbursement.config.TssProperties;
import com.nosota.disbursement.error.ChannelAccountConflictException;
import com.nosota.disbursement.error.ChannelAccountNotFoundException;
import com.nosota.disbursement.error.SignatureException;
import com.nosota.disbursement.error.UnsupportedSignatureOperationException;
import com.nosota.disbursement.ledger.LedgerAccount;
import com.nosota.disbursement.ledger.LedgerClient;
import com.nosota.disbursement.ledger.LedgerException;
import com.nosota.disbursement.ledger.LedgerNumberTracker;
import com.nosota.disbursement.ledger.LedgerTransactions;
import com.nosota.disbursement.mapper.ChannelAccountMapper;
import com.nosota.disbursement.model.ChannelAccount;
import com.nosota.disbursement.repository.ChannelAccountRepository;
import com.nosota.disbursement.signing.SignatureService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.stellar.sdk.Transaction;
import org.stellar.sdk.TransactionBuilder;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Manages the pool of channel accounts.
 *
 * <p>Owns the existence of channel accounts: creation (key generation, encrypted storage and
 * on-chain activation), deletion (merge back into the host account, then removal) and
 * verification against the ledger. Lease state during submission belongs to the submitter.
 *
 * <p>Rules:
 * <ul>
 *   <li>A stored account is always either activated on the ledger or about to be rolled back</li>
 *   <li>Leased accounts are never deleted; the caller gets a {@link ChannelAccountConflictException}</li>
 *   <li>Transient ledger errors are retried with exponential backoff before they are surfaced</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChannelAccountService {

    /**
     * Upper bound of the pool size.
     */
    public static final int MAX_NUMBER_OF_CHANNEL_ACCOUNTS = 1000;

    public static final int MIN_NUMBER_OF_CHANNEL_ACCOUNTS = 1;

    /**
     * Create-account operations packed into one activation transaction.
     */
    public static final int MAX_CREATE_ACCOUNT_OPERATIONS_PER_TRANSACTION = 19;

    private final ChannelAccountRepository channelAccountRepository;
    private final SignatureService signatureService;
    private final LedgerClient ledgerClient;
    private final LedgerNumberTracker ledgerNumberTracker;
    private final TssProperties tssProperties;
    private final RetryTemplate ledgerRetryTemplate;

    // ==================== View ====================

    /**
     * Lists every stored channel account, oldest first.
     */
    public List<ChannelAccountDTO> viewChannelAccounts() {
        return ChannelAccountMapper.INSTANCE.toDTOList(channelAccountRepository.findAllByOrderByCreatedAtAsc());
    }

    /**
     * Number of accounts in the usable pool (free or leased).
     */
    public long countUsable() {
        return channelAccountRepository.countByStateNot(ChannelAccountState.PENDING_DELETION);
    }

    // ==================== Create ====================

    /**
     * Creates and activates {@code count} channel accounts.
     *
     * <p>Accounts are activated in transactions of at most
     * {@value #MAX_CREATE_ACCOUNT_OPERATIONS_PER_TRANSACTION} create-account operations. Each batch is
     * stored LEASED, activated, then released. When an activation fails, the accounts of that batch
     * that cannot be found on the ledger are removed again and the error is rethrown; batches
     * activated before the failure stay in the pool.
     *
     * @param count Number of accounts to create (1..{@value #MAX_NUMBER_OF_CHANNEL_ACCOUNTS})
     * @return Pool sizing result listing the created accounts
     */
    public ChannelAccountPoolResponse createChannelAccounts(int count)
            throws LedgerException, SignatureException, UnsupportedSignatureOperationException {
        validateCount(count);
        long before = countUsable();
        if (before + count > MAX_NUMBER_OF_CHANNEL_ACCOUNTS) {
            throw new IllegalArgumentException(String.format(
                    "Creating %d channel accounts would exceed the limit of %d (current: %d)",
                    count, MAX_NUMBER_OF_CHANNEL_ACCOUNTS, before));
        }

        log.info("Creating channel accounts: count={}, current={}", count, before);

        List<String> created = new ArrayList<>(count);
        int remaining = count;
        while (remaining > 0) {
            int batchSize = Math.min(remaining, MAX_CREATE_ACCOUNT_OPERATIONS_PER_TRANSACTION);
            created.addAll(createBatch(batchSize));
            remaining -= batchSize;
        }

        long after = countUsable();
        log.info("Channel accounts created: count={}, poolSize={}", created.size(), after);

        return new ChannelAccountPoolResponse(null, before, after, created, List.of(), 0);
    }

    private List<String> createBatch(int batchSize)
            throws LedgerException, SignatureException, UnsupportedSignatureOperationException {
        // 1. Generate and store keys, LEASED until activated
        List<String> publicKeys = signatureService.getChannelAccountSigner().batchInsert(batchSize);

        // 2. Activate on the ledger
        try {
            activate(publicKeys);
        } catch (LedgerException | SignatureException e) {
            log.error("Channel account activation failed, rolling back batch: accounts={}, error={}",
                    publicKeys.size(), e.getMessage());
            rollbackBatch(publicKeys);
            throw e;
        }

        // 3. Make them available to the submitter
        LocalDateTime now = LocalDateTime.now();
        for (String publicKey : publicKeys) {
            channelAccountRepository.release(publicKey, now, ChannelAccountState.LEASED, ChannelAccountState.FREE);
        }

        log.info("Activated channel account batch: size={}", publicKeys.size());
        return publicKeys;
    }

    private void activate(List<String> publicKeys) throws LedgerException, SignatureException {
        String hostAccountId = signatureService.getHostAccountId();
        TransactionBuilder builder = baseTransaction(hostAccountId);
        for (String publicKey : publicKeys) {
            builder.addOperation(LedgerTransactions.createAccount(
                    publicKey, tssProperties.getChannelAccounts().getStartingBalance()));
        }

        Transaction signed = signatureService.getHostSigner().sign(builder.build(), hostAccountId);

        withRetry("activate channel accounts", context -> ledgerClient.submitTransaction(signed));
    }

    /**
     * Removes the rows of a failed activation batch. Accounts that do exist on the ledger (the outcome
     * of the submission was unknown) are released. Accounts whose existence cannot be checked stay
     * LEASED until the lease sweep resolves them.
     */
    private void rollbackBatch(List<String> publicKeys) {
        LocalDateTime now = LocalDateTime.now();
        for (String publicKey : publicKeys) {
            Optional<Boolean> onLedger = existsOnLedgerIfKnown(publicKey);
            if (onLedger.isEmpty()) {
                log.warn("Activation of channel account unknown, left for the lease sweep: publicKey={}", publicKey);
            } else if (onLedger.get()) {
                log.warn("Keeping channel account activated despite the failure: publicKey={}", publicKey);
                channelAccountRepository.release(publicKey, now, ChannelAccountState.LEASED, ChannelAccountState.FREE);
            } else {
                channelAccountRepository.deleteByPublicKeyAndState(publicKey, ChannelAccountState.LEASED);
            }
        }
    }

    private Optional<Boolean> existsOnLedgerIfKnown(String publicKey) {
        try {
            return Optional.of(existsOnLedger(publicKey));
        } catch (LedgerException e) {
            log.warn("Unable to check channel account on ledger: publicKey={}, error={}", publicKey, e.getMessage());
            return Optional.empty();
        }
    }

    // ==================== Ensure count ====================

    /**
     * Resizes the pool to {@code count} usable accounts.
     *
     * <p>Creates the missing accounts, or deletes the oldest free accounts. Leased accounts are never
     * deleted: when not enough free accounts exist, the pool is reduced as far as possible and a
     * {@link ChannelAccountConflictException} carrying the partial result reports the shortfall.
     *
     * @param count Target pool size (1..{@value #MAX_NUMBER_OF_CHANNEL_ACCOUNTS})
     * @return Pool sizing result
     */
    public ChannelAccountPoolResponse ensureChannelAccountsCount(int count)
            throws LedgerException, SignatureException, UnsupportedSignatureOperationException,
            ChannelAccountConflictException {
        validateCount(count);
        long before = countUsable();

        if (before == count) {
            log.info("Channel account pool already has the requested size: count={}", count);
            return new ChannelAccountPoolResponse(count, before, before, List.of(), List.of(), 0);
        }

        if (before < count) {
            ChannelAccountPoolResponse created = createChannelAccounts((int) (count - before));
            return new ChannelAccountPoolResponse(count, before, created.after(), created.created(), List.of(), 0);
        }

        int excess = (int) (before - count);
        log.info("Reducing channel account pool: current={}, target={}, excess={}", before, count, excess);

        List<String> deleted = new ArrayList<>(excess);
        while (deleted.size() < excess) {
            List<ChannelAccount> candidates = channelAccountRepository.findOldestFree(excess - deleted.size());
            if (candidates.isEmpty()) {
                break;
            }
            int deletedInRound = 0;
            for (ChannelAccount candidate : candidates) {
                try {
                    deleteChannelAccount(candidate.getPublicKey());
                    deleted.add(candidate.getPublicKey());
                    deletedInRound++;
                } catch (ChannelAccountConflictException | ChannelAccountNotFoundException e) {
                    log.debug("Channel account taken while reducing the pool: publicKey={}", candidate.getPublicKey());
                }
            }
            if (deletedInRound == 0) {
                break;
            }
        }

        long after = countUsable();
        int shortfall = excess - deleted.size();
        ChannelAccountPoolResponse result = new ChannelAccountPoolResponse(count, before, after, List.of(), deleted, shortfall);

        if (shortfall > 0) {
            log.warn("Channel account pool could not be reduced to target, remaining accounts are leased: " +
                    "target={}, after={}, shortfall={}", count, after, shortfall);
            throw new ChannelAccountConflictException(String.format(
                    "Could not reduce channel account pool to %d: %d account(s) are leased", count, shortfall), result);
        }

        log.info("Channel account pool reduced: target={}, deleted={}", count, deleted.size());
        return result;
    }

    // ==================== Delete ====================

    /**
     * Deletes one channel account: merges it into the host account on the ledger, then removes it.
     * An account missing from the ledger is only removed from storage.
     *
     * @param publicKey Channel account id
     * @throws ChannelAccountConflictException when the account is leased or already being deleted
     * @throws ChannelAccountNotFoundException when the account is not stored
     */
    public void deleteChannelAccount(String publicKey)
            throws ChannelAccountNotFoundException, ChannelAccountConflictException, LedgerException, SignatureException {
        LocalDateTime now = LocalDateTime.now();
        int marked = channelAccountRepository.compareAndSetState(
                publicKey, ChannelAccountState.FREE, ChannelAccountState.PENDING_DELETION, now);
        if (marked == 0) {
            ChannelAccount account = channelAccountRepository.findById(publicKey)
                    .orElseThrow(() -> new ChannelAccountNotFoundException("Channel account not found: " + publicKey));
            throw new ChannelAccountConflictException(String.format(
                    "Channel account %s cannot be deleted while %s", publicKey, account.getState()));
        }

        try {
            if (existsOnLedger(publicKey)) {
                mergeIntoHost(publicKey);
            } else {
                log.warn("Channel account not found on ledger, removing from storage only: publicKey={}", publicKey);
            }
        } catch (LedgerException | SignatureException e) {
            // the merge may have been applied even though the response was lost
            Optional<Boolean> onLedger = existsOnLedgerIfKnown(publicKey);
            if (onLedger.isEmpty()) {
                log.error("Failed to delete channel account, left pending deletion: publicKey={}, error={}",
                        publicKey, e.getMessage());
                throw e;
            }
            if (onLedger.get()) {
                channelAccountRepository.compareAndSetState(
                        publicKey, ChannelAccountState.PENDING_DELETION, ChannelAccountState.FREE, LocalDateTime.now());
                log.error("Failed to delete channel account, returned to pool: publicKey={}, error={}",
                        publicKey, e.getMessage());
                throw e;
            }
            log.warn("Channel account merged despite the error, removing from storage: publicKey={}, error={}",
                    publicKey, e.getMessage());
        }

        removeStoredAccount(publicKey);
        log.info("Channel account deleted: publicKey={}", publicKey);
    }

    /**
     * Deletes every free channel account. Leased accounts are kept and reported as a conflict.
     */
    public ChannelAccountPoolResponse deleteAllChannelAccounts()
            throws LedgerException, SignatureException, ChannelAccountConflictException {
        long before = countUsable();
        List<String> deleted = new ArrayList<>();
        int skipped = 0;

        for (ChannelAccount account : channelAccountRepository.findAllByOrderByCreatedAtAsc()) {
            if (!account.isFree()) {
                skipped++;
                continue;
            }
            try {
                deleteChannelAccount(account.getPublicKey());
                deleted.add(account.getPublicKey());
            } catch (ChannelAccountConflictException | ChannelAccountNotFoundException e) {
                log.debug("Channel account taken while deleting all: publicKey={}", account.getPublicKey());
                skipped++;
            }
        }

        long after = countUsable();
        ChannelAccountPoolResponse result = new ChannelAccountPoolResponse(null, before, after, List.of(), deleted, skipped);
        if (skipped > 0) {
            log.warn("Delete all left leased channel accounts in place: deleted={}, skipped={}", deleted.size(), skipped);
            throw new ChannelAccountConflictException(String.format(
                    "%d channel account(s) could not be deleted because they are leased", skipped), result);
        }

        log.info("All channel accounts deleted: deleted={}", deleted.size());
        return result;
    }

    private void mergeIntoHost(String publicKey) throws LedgerException, SignatureException {
        String hostAccountId = signatureService.getHostAccountId();
        Transaction transaction = baseTransaction(hostAccountId)
                .addOperation(LedgerTransactions.accountMerge(publicKey, hostAccountId))
                .build();

        signatureService.getHostSigner().sign(transaction, hostAccountId);
        Transaction signed = signatureService.getChannelAccountSigner().sign(transaction, publicKey);

        withRetry("merge channel account " + publicKey, context -> ledgerClient.submitTransaction(signed));
    }

    private void removeStoredAccount(String publicKey) throws SignatureException {
        try {
            signatureService.getChannelAccountSigner().delete(publicKey);
        } catch (UnsupportedSignatureOperationException e) {
            log.debug("Channel account signer holds no key to delete: publicKey={}", publicKey);
        }
        channelAccountRepository.deleteByPublicKeyAndState(publicKey, ChannelAccountState.PENDING_DELETION);
    }

    // ==================== Verify ====================

    /**
     * Checks every stored account against the ledger.
     *
     * @param pruneInvalid Remove accounts that do not exist on the ledger (leased ones are skipped)
     * @return Verification report
     */
    public ChannelAccountVerificationResponse verifyChannelAccounts(boolean pruneInvalid) throws LedgerException {
        List<ChannelAccount> accounts = channelAccountRepository.findAllByOrderByCreatedAtAsc();
        List<String> invalid = new ArrayList<>();
        List<String> pruned = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (ChannelAccount account : accounts) {
            String publicKey = account.getPublicKey();
            if (existsOnLedger(publicKey)) {
                continue;
            }

            invalid.add(publicKey);
            log.warn("Channel account missing on ledger: publicKey={}, state={}", publicKey, account.getState());

            if (!pruneInvalid) {
                continue;
            }
            int removed = channelAccountRepository.deleteByPublicKeyAndState(publicKey, ChannelAccountState.FREE)
                    + channelAccountRepository.deleteByPublicKeyAndState(publicKey, ChannelAccountState.PENDING_DELETION);
            if (removed > 0) {
                pruned.add(publicKey);
            } else {
                skipped.add(publicKey);
            }
        }

        log.info("Channel accounts verified: checked={}, invalid={}, pruned={}, skipped={}",
                accounts.size(), invalid.size(), pruned.size(), skipped.size());
        return new ChannelAccountVerificationResponse(accounts.size(), invalid, pruned, skipped);
    }

    // ==================== Helpers ====================

    private TransactionBuilder baseTransaction(String hostAccountId) throws LedgerException {
        LedgerAccount hostAccount = withRetry("load host account", context -> ledgerClient.getAccount(hostAccountId));
        long maxLedger = withRetry("load ledger number", context -> ledgerNumberTracker.getMaxLedgerBound());

        return LedgerTransactions.builder(
                signatureService.getNetwork(),
                hostAccount,
                tssProperties.getMaxBaseFee(),
                Instant.now().plus(tssProperties.getTransactionTimeout()).getEpochSecond(),
                maxLedger);
    }

    private boolean existsOnLedger(String publicKey) throws LedgerException {
        try {
            withRetry("load channel account " + publicKey, context -> ledgerClient.getAccount(publicKey));
            return true;
        } catch (LedgerException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Runs a ledger call, retrying transient failures with backoff. Permanent rejections and
     * not-found answers are returned to the caller immediately.
     */
    private <T> T withRetry(String operation, RetryCallback<T, LedgerException> call) throws LedgerException {
        return ledgerRetryTemplate.execute(context -> {
            try {
                return call.doWithRetry(context);
            } catch (LedgerException e) {
                if (!e.isTransient()) {
                    context.setExhaustedOnly();
                } else {
                    log.warn("Transient ledger error, will retry: operation={}, attempt={}, error={}",
                            operation, context.getRetryCount() + 1, e.getMessage());
                }
                throw e;
            }
        });
    }

    private static void validateCount(int count) {
        if (count < MIN_NUMBER_OF_CHANNEL_ACCOUNTS || count > MAX_NUMBER_OF_CHANNEL_ACCOUNTS) {
            throw new IllegalArgumentException(String.format(
                    "Channel account count must be between %d and %d, got %d",
                    MIN_NUMBER_OF_CHANNEL_ACCOUNTS, MAX_NUMBER_OF_CHANNEL_ACCOUNTS, count));
        }
    }
}
