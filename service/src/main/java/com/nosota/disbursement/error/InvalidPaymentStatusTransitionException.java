package com.nosota.disbursement.error;

import com.nosota.disbursement.api.model.PaymentStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a payment status change is not an edge of the payment lifecycle graph.
 * The payment is left unchanged.
 */
@Getter
public class InvalidPaymentStatusTransitionException extends Exception {

    private final UUID paymentId;
    private final PaymentStatus from;
    private final PaymentStatus to;

    public InvalidPaymentStatusTransitionException(UUID paymentId, PaymentStatus from, PaymentStatus to, String message) {
        super(message);
        this.paymentId = paymentId;
        this.from = from;
        this.to = to;
    }
}
