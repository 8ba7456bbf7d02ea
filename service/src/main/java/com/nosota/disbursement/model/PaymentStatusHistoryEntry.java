package com.nosota.disbursement.model;

import com.nosota.disbursement.api.model.PaymentStatus;

import java.time.LocalDateTime;

/**
 * Element of the append-only payment status history (stored as a JSON array).
 */
public record PaymentStatusHistoryEntry(
        PaymentStatus status,
        String message,
        LocalDateTime timestamp
) {
}
