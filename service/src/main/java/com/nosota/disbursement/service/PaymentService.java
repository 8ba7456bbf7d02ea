package com.nosota.disbursement.service;

import com.nosota.disbursement.api.model.PaymentStatus;
import com.nosota.disbursement.api.model.PaymentType;
import com.nosota.disbursement.api.response.PaymentResponse;
import com.nosota.disbursement.error.InvalidPaymentStatusTransitionException;
import com.nosota.disbursement.error.PaymentNotFoundException;
import com.nosota.disbursement.mapper.PaymentMapper;
import com.nosota.disbursement.model.Payment;
import com.nosota.disbursement.model.PaymentStatusHistoryEntry;
import com.nosota.disbursement.repository.PaymentRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Payment status management for the submitter and for operators.
 *
 * <p>Every status change locks the payment row, is validated by {@link PaymentStatusStateMachine}
 * and appends an entry to the status history. A rejected change leaves the payment untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final PaymentStatusStateMachine stateMachine;

    public PaymentResponse getPayment(UUID paymentId) throws PaymentNotFoundException {
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new PaymentNotFoundException("Payment not found: " + paymentId));
        return PaymentMapper.INSTANCE.toResponse(payment);
    }

    // ==================== Claim ====================

    /**
     * Claims up to {@code limit} READY payments and marks them PENDING.
     *
     * <p>Rows are selected oldest update first with {@code FOR UPDATE SKIP LOCKED}, so concurrent
     * claimers (threads or processes) never claim the same payment. {@code directPaymentShare} of the
     * limit is reserved for DIRECT payments; a share left unused by one type is filled with the other.
     *
     * @param limit              Maximum number of payments
     * @param directPaymentShare Share of the limit reserved for DIRECT payments (0..1)
     * @return Claimed payments, now PENDING
     */
    @Transactional
    public List<Payment> claimBatch(int limit, double directPaymentShare) {
        if (limit <= 0) {
            return List.of();
        }
        double share = Math.max(0.0, Math.min(1.0, directPaymentShare));
        int directQuota = (int) Math.round(limit * share);

        Map<UUID, Payment> claimed = new LinkedHashMap<>();
        List<Payment> direct = selectReady(PaymentType.DIRECT, directQuota);
        direct.forEach(p -> claimed.put(p.getId(), p));
        selectReady(PaymentType.DISBURSEMENT, limit - claimed.size()).forEach(p -> claimed.put(p.getId(), p));

        // Disbursements did not use their share: fill it with more direct payments.
        // Rows locked by this transaction are returned again, hence the de-duplication by id.
        if (claimed.size() < limit && direct.size() == directQuota) {
            for (Payment payment : selectReady(PaymentType.DIRECT, directQuota + limit - claimed.size())) {
                claimed.putIfAbsent(payment.getId(), payment);
            }
        }

        LocalDateTime now = LocalDateTime.now();
        for (Payment payment : claimed.values()) {
            payment.setStatus(PaymentStatus.PENDING);
            appendHistory(payment, PaymentStatus.PENDING, "claimed for submission", now);
            payment.setUpdatedAt(now);
        }
        List<Payment> result = paymentRepository.saveAll(claimed.values());

        if (!result.isEmpty()) {
            log.debug("Claimed payments: count={}, direct={}, limit={}", result.size(),
                    result.stream().filter(p -> p.getType() == PaymentType.DIRECT).count(), limit);
        }
        return result;
    }

    private List<Payment> selectReady(PaymentType type, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return paymentRepository.findReadyForUpdateSkipLocked(type.name(), limit);
    }

    // ==================== Status changes ====================

    /**
     * Moves a payment to a new status.
     *
     * @param paymentId Payment id
     * @param newStatus Target status
     * @param message   History message
     * @param txHash    Ledger transaction hash to record, null to keep the current one
     * @return Updated payment
     */
    @Transactional
    public Payment updateStatus(UUID paymentId, PaymentStatus newStatus, String message, String txHash)
            throws PaymentNotFoundException, InvalidPaymentStatusTransitionException {
        return transition(paymentId, newStatus, message, payment -> {
            if (txHash != null) {
                payment.setLedgerTransactionHash(txHash);
            }
        });
    }

    /**
     * Records a submission attempt on a PENDING payment before the transaction is sent: the channel
     * account, the transaction hash and the incremented attempt count.
     *
     * @throws InvalidPaymentStatusTransitionException when the payment is no longer PENDING (canceled meanwhile)
     */
    @Transactional
    public Payment recordSubmissionAttempt(UUID paymentId, String channelAccount, String txHash)
            throws PaymentNotFoundException, InvalidPaymentStatusTransitionException {
        Payment payment = lockPayment(paymentId);
        if (payment.getStatus() != PaymentStatus.PENDING) {
            throw new InvalidPaymentStatusTransitionException(paymentId, payment.getStatus(), PaymentStatus.PENDING,
                    String.format("Payment %s is %s, submission aborted", paymentId, payment.getStatus()));
        }
        payment.setChannelAccount(channelAccount);
        payment.setLedgerTransactionHash(txHash);
        payment.setSubmissionAttempts(payment.getSubmissionAttempts() + 1);
        payment.setUpdatedAt(LocalDateTime.now());

        log.debug("Recorded submission attempt: paymentId={}, channelAccount={}, attempt={}, hash={}",
                paymentId, channelAccount, payment.getSubmissionAttempts(), txHash);
        return paymentRepository.save(payment);
    }

    @Transactional
    public Payment markSuccess(UUID paymentId, String txHash)
            throws PaymentNotFoundException, InvalidPaymentStatusTransitionException {
        return transition(paymentId, PaymentStatus.SUCCESS, "transaction confirmed on ledger", payment -> {
            payment.setLedgerTransactionHash(txHash);
            payment.setLastErrorClassification(null);
        });
    }

    @Transactional
    public Payment markFailed(UUID paymentId, String message, String errorClassification)
            throws PaymentNotFoundException, InvalidPaymentStatusTransitionException {
        return transition(paymentId, PaymentStatus.FAILED, message,
                payment -> payment.setLastErrorClassification(errorClassification));
    }

    /**
     * Returns a PENDING payment to READY for a later attempt. The attempt count is left as is.
     */
    @Transactional
    public Payment requeue(UUID paymentId, String message, String errorClassification)
            throws PaymentNotFoundException, InvalidPaymentStatusTransitionException {
        return transition(paymentId, PaymentStatus.READY, message, payment -> {
            if (errorClassification != null) {
                payment.setLastErrorClassification(errorClassification);
            }
        });
    }

    // ==================== Operator actions ====================

    /**
     * DRAFT -> READY.
     */
    @Transactional
    public PaymentResponse markReady(UUID paymentId, String message)
            throws PaymentNotFoundException, InvalidPaymentStatusTransitionException {
        Payment payment = transition(paymentId, PaymentStatus.READY, orDefault(message, "marked ready"), p -> { });
        return PaymentMapper.INSTANCE.toResponse(payment);
    }

    /**
     * FAILED -> READY with a fresh attempt budget.
     */
    @Transactional
    public PaymentResponse retry(UUID paymentId, String message)
            throws PaymentNotFoundException, InvalidPaymentStatusTransitionException {
        Payment payment = transition(paymentId, PaymentStatus.READY, orDefault(message, "retry requested"), p -> {
            p.setSubmissionAttempts(0);
            p.setLastErrorClassification(null);
            p.setLedgerTransactionHash(null);
            p.setChannelAccount(null);
        });
        return PaymentMapper.INSTANCE.toResponse(payment);
    }

    /**
     * READY or PENDING -> CANCELED.
     */
    @Transactional
    public PaymentResponse cancel(UUID paymentId, String message)
            throws PaymentNotFoundException, InvalidPaymentStatusTransitionException {
        Payment payment = transition(paymentId, PaymentStatus.CANCELED, orDefault(message, "canceled"), p -> { });
        return PaymentMapper.INSTANCE.toResponse(payment);
    }

    // ==================== Helpers ====================

    private Payment transition(UUID paymentId, PaymentStatus newStatus, String message, Consumer<Payment> changes)
            throws PaymentNotFoundException, InvalidPaymentStatusTransitionException {
        Payment payment = lockPayment(paymentId);
        PaymentStatus oldStatus = payment.getStatus();
        stateMachine.validateTransition(paymentId, oldStatus, newStatus);

        LocalDateTime now = LocalDateTime.now();
        payment.setStatus(newStatus);
        changes.accept(payment);
        appendHistory(payment, newStatus, message, now);
        payment.setUpdatedAt(now);
        Payment saved = paymentRepository.save(payment);

        log.info("Payment status changed: paymentId={}, {} -> {}, message={}", paymentId, oldStatus, newStatus, message);
        return saved;
    }

    private Payment lockPayment(UUID paymentId) throws PaymentNotFoundException {
        return paymentRepository.getOneForUpdate(paymentId)
                .orElseThrow(() -> new PaymentNotFoundException("Payment not found: " + paymentId));
    }

    static void appendHistory(Payment payment, PaymentStatus status, String message, LocalDateTime timestamp) {
        // a new list so Hibernate sees the JSON column as changed
        List<PaymentStatusHistoryEntry> history = new ArrayList<>(
                payment.getStatusHistory() == null ? List.of() : payment.getStatusHistory());
        history.add(new PaymentStatusHistoryEntry(status, message, timestamp));
        payment.setStatusHistory(history);
    }

    private static String orDefault(String message, String defaultMessage) {
        return message == null || message.isBlank() ? defaultMessage : message;
    }
}
