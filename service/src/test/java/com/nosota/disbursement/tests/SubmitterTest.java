package com.nosota.disbursement.tests;

import com.nosota.disbursement.TestBase;
import com.nosota.disbursement.api.model.ChannelAccountState;
import com.nosota.disbursement.api.model.PaymentStatus;
import com.nosota.disbursement.api.model.PaymentType;
import com.nosota.disbursement.ledger.LedgerException;
import com.nosota.disbursement.ledger.LedgerTransactions;
import com.nosota.disbursement.model.Payment;
import com.nosota.disbursement.submitter.SubmissionOutcome;
import com.nosota.disbursement.submitter.TransactionWorker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.stellar.sdk.AssetTypeNative;
import org.stellar.sdk.PaymentOperation;
import org.stellar.sdk.Transaction;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Transaction Submission Tests")
public class SubmitterTest extends TestBase {

    @Autowired
    private TransactionWorker transactionWorker;

    private Payment claimOne() {
        List<Payment> claimed = paymentService.claimBatch(1, 0.25);
        assertThat(claimed).hasSize(1);
        return claimed.get(0);
    }

    private Transaction lastSubmitted() {
        List<Transaction> submitted = fakeLedger.getSubmitted();
        return submitted.get(submitted.size() - 1);
    }

    @Test
    @DisplayName("SUB-001: Ready payment is submitted through a channel account and confirmed")
    void testSuccessfulSubmission() throws Exception {
        String channelAccount = channelAccountService.createChannelAccounts(1).created().get(0);
        Payment payment = createReadyPayment(createFundedTenant());

        Payment claimed = claimOne();
        assertThat(claimed.getId()).isEqualTo(payment.getId());
        assertThat(reloadPayment(payment.getId()).getStatus()).isEqualTo(PaymentStatus.PENDING);

        SubmissionOutcome outcome = transactionWorker.process(claimed);

        assertThat(outcome).isEqualTo(SubmissionOutcome.SUCCESS);
        Payment reloaded = reloadPayment(payment.getId());
        assertThat(reloaded.getStatus()).isEqualTo(PaymentStatus.SUCCESS);
        assertThat(reloaded.getSubmissionAttempts()).isEqualTo(1);
        assertThat(reloaded.getChannelAccount()).isEqualTo(channelAccount);
        assertThat(reloaded.getLedgerTransactionHash()).isEqualTo(lastSubmitted().hashHex());
        assertThat(reloaded.getStatusHistory())
                .extracting(h -> h.status())
                .containsExactly(PaymentStatus.DRAFT, PaymentStatus.READY, PaymentStatus.PENDING, PaymentStatus.SUCCESS);

        Transaction transaction = lastSubmitted();
        assertThat(transaction.getSourceAccount()).isEqualTo(channelAccount);
        PaymentOperation operation = (PaymentOperation) transaction.getOperations()[0];
        assertThat(operation.getSourceAccount()).isEqualTo(HOST_DISTRIBUTION_ACCOUNT.getAccountId());
        assertThat(operation.getDestination()).isEqualTo(payment.getDestination());
        assertThat(operation.getAsset()).isInstanceOf(AssetTypeNative.class);
        assertThat(new BigDecimal(operation.getAmount())).isEqualByComparingTo("10.5");
        assertThat(LedgerTransactions.isSignedBy(transaction, channelAccount)).isTrue();
        assertThat(LedgerTransactions.isSignedBy(transaction, HOST_DISTRIBUTION_ACCOUNT.getAccountId())).isTrue();
        assertThat(transaction.getPreconditions().getLedgerBounds().getMaxLedger()).isPositive();
        assertThat(transaction.getFee()).isEqualTo(10_000L);

        assertThat(reloadChannelAccount(channelAccount).getState()).isEqualTo(ChannelAccountState.FREE);
    }

    @Test
    @DisplayName("SUB-002: Horizon timeout on a transaction that never lands requeues, then fails after max attempts")
    void testTimeoutRequeuesThenFails() throws Exception {
        String channelAccount = channelAccountService.createChannelAccounts(1).created().get(0);
        Payment payment = createReadyPayment(createFundedTenant());

        fakeLedger.failNextSubmission(new LedgerException("horizon timeout", 504));
        assertThat(transactionWorker.process(claimOne())).isEqualTo(SubmissionOutcome.REQUEUED);

        Payment reloaded = reloadPayment(payment.getId());
        assertThat(reloaded.getStatus()).isEqualTo(PaymentStatus.READY);
        assertThat(reloaded.getSubmissionAttempts()).isEqualTo(1);
        assertThat(reloaded.getLastErrorClassification()).isEqualTo("http_504");
        assertThat(reloadChannelAccount(channelAccount).getState()).isEqualTo(ChannelAccountState.FREE);

        fakeLedger.failNextSubmission(new LedgerException("horizon timeout", 504));
        assertThat(transactionWorker.process(claimOne())).isEqualTo(SubmissionOutcome.REQUEUED);

        fakeLedger.failNextSubmission(new LedgerException("horizon timeout", 504));
        assertThat(transactionWorker.process(claimOne())).isEqualTo(SubmissionOutcome.FAILED);

        reloaded = reloadPayment(payment.getId());
        assertThat(reloaded.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(reloaded.getSubmissionAttempts()).isEqualTo(3);
        assertThat(reloadChannelAccount(channelAccount).getState()).isEqualTo(ChannelAccountState.FREE);
    }

    @Test
    @DisplayName("SUB-003: Permanent rejection fails the payment on the first attempt")
    void testPermanentRejection() throws Exception {
        channelAccountService.createChannelAccounts(1);
        Payment payment = createReadyPayment(createFundedTenant());

        fakeLedger.failNextSubmission(new LedgerException("underfunded", 400, "tx_failed", List.of("op_underfunded")));
        assertThat(transactionWorker.process(claimOne())).isEqualTo(SubmissionOutcome.FAILED);

        Payment reloaded = reloadPayment(payment.getId());
        assertThat(reloaded.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(reloaded.getSubmissionAttempts()).isEqualTo(1);
        assertThat(reloaded.getLastErrorClassification()).isEqualTo("op_underfunded");
    }

    @Test
    @DisplayName("SUB-004: Transient rejection with result codes requeues without a ledger lookup")
    void testTransientRejectionRequeues() throws Exception {
        channelAccountService.createChannelAccounts(1);
        Payment payment = createReadyPayment(createFundedTenant());

        fakeLedger.failNextSubmission(new LedgerException("fee surge", 400, "tx_insufficient_fee", List.of()));
        assertThat(transactionWorker.process(claimOne())).isEqualTo(SubmissionOutcome.REQUEUED);

        Payment reloaded = reloadPayment(payment.getId());
        assertThat(reloaded.getStatus()).isEqualTo(PaymentStatus.READY);
        assertThat(reloaded.getLastErrorClassification()).isEqualTo("tx_insufficient_fee");
    }

    @Test
    @DisplayName("SUB-005: Horizon timeout on a transaction that did land resolves to SUCCESS")
    void testTimeoutOnAppliedTransaction() throws Exception {
        channelAccountService.createChannelAccounts(1);
        Payment payment = createReadyPayment(createFundedTenant());

        fakeLedger.applyNextSubmissionThenFail(new LedgerException("horizon timeout", 504));
        assertThat(transactionWorker.process(claimOne())).isEqualTo(SubmissionOutcome.SUCCESS);

        Payment reloaded = reloadPayment(payment.getId());
        assertThat(reloaded.getStatus()).isEqualTo(PaymentStatus.SUCCESS);
        assertThat(reloaded.getSubmissionAttempts()).isEqualTo(1);
        // resolved by lookup, never resubmitted
        assertThat(fakeLedger.getSubmitted()).hasSize(2);
    }

    @Test
    @DisplayName("SUB-006: No free channel account within the lease wait requeues without using an attempt")
    void testLeaseWaitTimeout() {
        Payment payment = createReadyPayment(createFundedTenant());

        assertThat(transactionWorker.process(claimOne())).isEqualTo(SubmissionOutcome.REQUEUED);

        Payment reloaded = reloadPayment(payment.getId());
        assertThat(reloaded.getStatus()).isEqualTo(PaymentStatus.READY);
        assertThat(reloaded.getSubmissionAttempts()).isZero();
        assertThat(fakeLedger.getSubmitted()).isEmpty();
    }

    @Test
    @DisplayName("SUB-007: Payment canceled after the claim is not submitted")
    void testCanceledWhilePending() throws Exception {
        String channelAccount = channelAccountService.createChannelAccounts(1).created().get(0);
        Payment payment = createReadyPayment(createFundedTenant());
        int submittedBefore = fakeLedger.getSubmitted().size();

        Payment claimed = claimOne();
        paymentService.cancel(payment.getId(), "canceled by operator");

        assertThat(transactionWorker.process(claimed)).isEqualTo(SubmissionOutcome.ABORTED);
        assertThat(reloadPayment(payment.getId()).getStatus()).isEqualTo(PaymentStatus.CANCELED);
        assertThat(fakeLedger.getSubmitted()).hasSize(submittedBefore);
        assertThat(reloadChannelAccount(channelAccount).getState()).isEqualTo(ChannelAccountState.FREE);
    }

    @Test
    @DisplayName("SUB-008: Tenant without an active distribution account fails the payment")
    void testMissingDistributionAccount() throws Exception {
        channelAccountService.createChannelAccounts(1);
        Payment payment = createReadyPayment(createTenant(null));

        assertThat(transactionWorker.process(claimOne())).isEqualTo(SubmissionOutcome.FAILED);

        Payment reloaded = reloadPayment(payment.getId());
        assertThat(reloaded.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(reloaded.getLastErrorClassification()).isEqualTo("distribution_account_unavailable");
    }

    @Test
    @DisplayName("SUB-009: Failed payment retried by an operator starts with a fresh attempt budget")
    void testRetryAfterFailure() throws Exception {
        channelAccountService.createChannelAccounts(1);
        Payment payment = createReadyPayment(createFundedTenant());
        fakeLedger.failNextSubmission(new LedgerException("no trust", 400, "tx_failed", List.of("op_no_trust")));
        transactionWorker.process(claimOne());

        paymentService.retry(payment.getId(), "trustline added");
        assertThat(reloadPayment(payment.getId()).getSubmissionAttempts()).isZero();

        assertThat(transactionWorker.process(claimOne())).isEqualTo(SubmissionOutcome.SUCCESS);
    }

    @Test
    @DisplayName("SUB-010: Concurrent claims never return the same payment")
    void testConcurrentClaimsAreDisjoint() throws Exception {
        String tenantId = createFundedTenant();
        for (int i = 0; i < 20; i++) {
            createReadyPayment(tenantId);
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<List<Payment>>> claimers = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                claimers.add(() -> paymentService.claimBatch(7, 0.25));
            }
            List<UUID> claimedIds = new ArrayList<>();
            for (Future<List<Payment>> future : executor.invokeAll(claimers)) {
                future.get().forEach(p -> claimedIds.add(p.getId()));
            }

            assertThat(claimedIds).hasSize(20);
            assertThat(new HashSet<>(claimedIds)).hasSize(20);
            assertThat(paymentRepository.countByStatus(PaymentStatus.PENDING)).isEqualTo(20);
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }
    }

    @Test
    @DisplayName("SUB-011: Claims reserve a share for direct payments and fill unused share with the other type")
    void testDirectPaymentShare() {
        String tenantId = createFundedTenant();
        for (int i = 0; i < 4; i++) {
            createPayment(tenantId, PaymentType.DIRECT, PaymentStatus.READY, BigDecimal.ONE);
        }
        for (int i = 0; i < 10; i++) {
            createPayment(tenantId, PaymentType.DISBURSEMENT, PaymentStatus.READY, BigDecimal.ONE);
        }

        List<Payment> mixed = paymentService.claimBatch(4, 0.25);
        assertThat(mixed).filteredOn(p -> p.getType() == PaymentType.DIRECT).hasSize(1);
        assertThat(mixed).filteredOn(p -> p.getType() == PaymentType.DISBURSEMENT).hasSize(3);

        // 3 direct and 7 disbursements left: the direct quota is used in full, the rest is all that remains
        List<Payment> rest = paymentService.claimBatch(12, 0.25);
        assertThat(rest).hasSize(10);
        assertThat(rest).filteredOn(p -> p.getType() == PaymentType.DIRECT).hasSize(3);
        assertThat(new HashSet<>(rest.stream().map(Payment::getId).toList())).hasSize(10);
    }

    @Test
    @DisplayName("SUB-012: A channel account is never used by two submissions at once")
    void testExclusiveChannelAccountUse() throws Exception {
        channelAccountService.createChannelAccounts(3);
        String tenantId = createFundedTenant();
        Set<UUID> paymentIds = new HashSet<>();
        for (int i = 0; i < 9; i++) {
            paymentIds.add(createReadyPayment(tenantId).getId());
        }
        fakeLedger.setSubmitDelayMillis(30);

        ExecutorService executor = Executors.newFixedThreadPool(6);
        try {
            for (int round = 0; round < 10 && paymentRepository.countByStatus(PaymentStatus.SUCCESS) < 9; round++) {
                List<Callable<SubmissionOutcome>> workers = paymentService.claimBatch(6, 0.25).stream()
                        .<Callable<SubmissionOutcome>>map(p -> () -> transactionWorker.process(p))
                        .toList();
                for (Future<SubmissionOutcome> future : executor.invokeAll(workers)) {
                    assertThat(future.get()).isIn(SubmissionOutcome.SUCCESS, SubmissionOutcome.REQUEUED);
                }
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }

        assertThat(fakeLedger.getConcurrentSourceViolations()).isZero();
        assertThat(paymentIds).allMatch(id -> reloadPayment(id).getStatus() == PaymentStatus.SUCCESS);
        assertThat(countChannelAccounts(ChannelAccountState.FREE)).isEqualTo(3);
    }
}
