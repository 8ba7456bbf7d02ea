package com.nosota.disbursement.service;

import com.nosota.disbursement.api.model.PaymentStatus;
import com.nosota.disbursement.error.InvalidPaymentStatusTransitionException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * State machine for validating PaymentStatus transitions.
 *
 * <p>State diagram:
 * <pre>
 *   DRAFT -> READY -> PENDING -> SUCCESS
 *              ^   \     |  \
 *              |    \    |   -> FAILED --(retry)--> READY
 *              |     \   v
 *              |      CANCELED
 *              +-- PENDING (transient failure requeue)
 * </pre>
 *
 * <p>SUCCESS and CANCELED are final. FAILED only leaves through an explicit retry.
 * A transition to the current status is not an edge of the graph and is rejected.
 */
@Component
public class PaymentStatusStateMachine {

    private static final Map<PaymentStatus, Set<PaymentStatus>> ALLOWED_TRANSITIONS = Map.of(
            PaymentStatus.DRAFT, EnumSet.of(PaymentStatus.READY),
            PaymentStatus.READY, EnumSet.of(PaymentStatus.PENDING, PaymentStatus.CANCELED),
            // READY: transient failure requeue and lease wait timeout
            PaymentStatus.PENDING, EnumSet.of(
                    PaymentStatus.SUCCESS,
                    PaymentStatus.FAILED,
                    PaymentStatus.CANCELED,
                    PaymentStatus.READY
            ),
            PaymentStatus.FAILED, EnumSet.of(PaymentStatus.READY)
    );

    /**
     * Validates if a status transition is allowed.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(PaymentStatus fromStatus, PaymentStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        Set<PaymentStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates if a status transition is allowed, throwing exception if not.
     *
     * @param paymentId  Payment being changed (for the error)
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @throws InvalidPaymentStatusTransitionException if transition is not allowed
     */
    public void validateTransition(UUID paymentId, PaymentStatus fromStatus, PaymentStatus toStatus)
            throws InvalidPaymentStatusTransitionException {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new InvalidPaymentStatusTransitionException(paymentId, fromStatus, toStatus,
                    String.format("Invalid payment status transition for %s: %s → %s. Allowed transitions from %s: %s",
                            paymentId, fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of())));
        }
    }
}
