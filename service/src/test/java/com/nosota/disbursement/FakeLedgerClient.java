package com.nosota.disbursement;

import com.nosota.disbursement.ledger.LedgerAccount;
import com.nosota.disbursement.ledger.LedgerClient;
import com.nosota.disbursement.ledger.LedgerException;
import com.nosota.disbursement.ledger.LedgerTransactionResult;
import com.nosota.disbursement.ledger.LedgerTransactions;
import org.stellar.sdk.AccountMergeOperation;
import org.stellar.sdk.CreateAccountOperation;
import org.stellar.sdk.Operation;
import org.stellar.sdk.PaymentOperation;
import org.stellar.sdk.Transaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory ledger for tests.
 *
 * <p>Checks what the real ledger checks for the operations in use: every required signer has a valid
 * signature, the source sequence number is the next one, payment destinations exist. Scripted failures
 * are consumed one per submission.
 */
public class FakeLedgerClient implements LedgerClient {

    /**
     * A scripted submission failure. With {@code applied} the transaction is applied before the error is returned,
     * like a Horizon timeout on a transaction that made it into a ledger.
     */
    public record ScriptedFailure(LedgerException error, boolean applied) {
    }

    private final Map<String, Long> accounts = new ConcurrentHashMap<>();
    private final Map<String, LedgerTransactionResult> transactions = new ConcurrentHashMap<>();
    private final Deque<ScriptedFailure> scriptedFailures = new ConcurrentLinkedDeque<>();
    private final List<Transaction> submitted = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> sourcesInFlight = ConcurrentHashMap.newKeySet();
    private final AtomicInteger concurrentSourceViolations = new AtomicInteger();
    private final AtomicLong ledger = new AtomicLong(1000);

    private volatile long ledgerStep = 1;
    private volatile long submitDelayMillis;

    public void reset() {
        accounts.clear();
        transactions.clear();
        scriptedFailures.clear();
        submitted.clear();
        sourcesInFlight.clear();
        concurrentSourceViolations.set(0);
        ledgerStep = 1;
        submitDelayMillis = 0;
    }

    public void createAccount(String accountId) {
        accounts.putIfAbsent(accountId, ledger.get() << 32);
    }

    public void removeAccount(String accountId) {
        accounts.remove(accountId);
    }

    public boolean hasAccount(String accountId) {
        return accounts.containsKey(accountId);
    }

    public void failNextSubmission(LedgerException error) {
        scriptedFailures.add(new ScriptedFailure(error, false));
    }

    public void applyNextSubmissionThenFail(LedgerException error) {
        scriptedFailures.add(new ScriptedFailure(error, true));
    }

    public void recordTransaction(LedgerTransactionResult result) {
        transactions.put(result.hash(), result);
    }

    public void setLedgerStep(long ledgerStep) {
        this.ledgerStep = ledgerStep;
    }

    public void setSubmitDelayMillis(long submitDelayMillis) {
        this.submitDelayMillis = submitDelayMillis;
    }

    public List<Transaction> getSubmitted() {
        synchronized (submitted) {
            return List.copyOf(submitted);
        }
    }

    public int getConcurrentSourceViolations() {
        return concurrentSourceViolations.get();
    }

    @Override
    public long getLatestLedgerSequence() {
        return ledger.addAndGet(ledgerStep);
    }

    @Override
    public LedgerAccount getAccount(String accountId) throws LedgerException {
        Long sequence = accounts.get(accountId);
        if (sequence == null) {
            throw new LedgerException("Account not found: " + accountId, 404);
        }
        return new LedgerAccount(accountId, sequence);
    }

    @Override
    public LedgerTransactionResult submitTransaction(Transaction transaction) throws LedgerException {
        submitted.add(transaction);
        String source = transaction.getSourceAccount();
        if (!sourcesInFlight.add(source)) {
            concurrentSourceViolations.incrementAndGet();
        }
        try {
            if (submitDelayMillis > 0) {
                sleep(submitDelayMillis);
            }
            ScriptedFailure failure = scriptedFailures.poll();
            if (failure != null && !failure.applied()) {
                throw failure.error();
            }
            LedgerTransactionResult result = apply(transaction);
            if (failure != null) {
                throw failure.error();
            }
            return result;
        } finally {
            sourcesInFlight.remove(source);
        }
    }

    @Override
    public LedgerTransactionResult getTransaction(String hash) throws LedgerException {
        LedgerTransactionResult result = transactions.get(hash);
        if (result == null) {
            throw new LedgerException("Transaction not found: " + hash, 404);
        }
        return result;
    }

    private synchronized LedgerTransactionResult apply(Transaction transaction) throws LedgerException {
        for (String signer : LedgerTransactions.requiredSigners(transaction)) {
            if (!LedgerTransactions.isSignedBy(transaction, signer)) {
                throw new LedgerException("Missing signature of " + signer, 400, "tx_bad_auth", List.of());
            }
        }

        String source = transaction.getSourceAccount();
        Long sequence = accounts.get(source);
        if (sequence == null) {
            throw new LedgerException("Source account not found", 400, "tx_no_source_account", List.of());
        }
        if (transaction.getSequenceNumber() != sequence + 1) {
            throw new LedgerException("Bad sequence number", 400, "tx_bad_seq", List.of());
        }

        for (Operation operation : transaction.getOperations()) {
            if (operation instanceof PaymentOperation payment && !accounts.containsKey(payment.getDestination())) {
                throw new LedgerException("Payment destination missing", 400, "tx_failed", List.of("op_no_destination"));
            }
        }

        accounts.put(source, sequence + 1);
        for (Operation operation : transaction.getOperations()) {
            if (operation instanceof CreateAccountOperation create) {
                createAccount(create.getDestination());
            } else if (operation instanceof AccountMergeOperation) {
                accounts.remove(operation.getSourceAccount() != null ? operation.getSourceAccount() : source);
            }
        }

        LedgerTransactionResult result = new LedgerTransactionResult(
                transaction.hashHex(), true, ledger.get(), "tx_success", List.of());
        transactions.put(result.hash(), result);
        return result;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
