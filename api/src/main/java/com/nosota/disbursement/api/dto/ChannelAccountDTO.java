package com.nosota.disbursement.api.dto;

import com.nosota.disbursement.api.model.ChannelAccountState;

import java.time.LocalDateTime;

/**
 * DTO for a channel account in the submission pool.
 * Never carries key material.
 *
 * @param publicKey               Ledger account id of the channel account
 * @param state                   Lease state (FREE, LEASED, PENDING_DELETION)
 * @param lockedUntilLedgerNumber Last ledger on which the current lease is valid (null when free)
 * @param leasedAt                Timestamp when the current lease was taken (null when free)
 * @param createdAt               Timestamp when the account was created
 * @param updatedAt               Timestamp of last update
 */
public record ChannelAccountDTO(
        String publicKey,
        ChannelAccountState state,
        Long lockedUntilLedgerNumber,
        LocalDateTime leasedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
