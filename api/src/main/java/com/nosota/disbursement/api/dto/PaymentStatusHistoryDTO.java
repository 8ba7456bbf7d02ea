package com.nosota.disbursement.api.dto;

import com.nosota.disbursement.api.model.PaymentStatus;

import java.time.LocalDateTime;

/**
 * One entry of a payment's status history.
 *
 * @param status    Status entered
 * @param message   Optional reason (ledger rejection, operator note)
 * @param timestamp When the status was entered
 */
public record PaymentStatusHistoryDTO(
        PaymentStatus status,
        String message,
        LocalDateTime timestamp
) {
}
