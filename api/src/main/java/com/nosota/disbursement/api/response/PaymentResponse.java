package com.nosota.disbursement.api.response;

import com.nosota.disbursement.api.dto.PaymentStatusHistoryDTO;
import com.nosota.disbursement.api.model.PaymentStatus;
import com.nosota.disbursement.api.model.PaymentType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for a payment and its submission state.
 *
 * @param id                      Payment UUID
 * @param tenantId                Tenant that owns the payment
 * @param type                    DISBURSEMENT or DIRECT
 * @param amount                  Amount in asset units
 * @param assetCode               Asset code (native asset when issuer is null)
 * @param assetIssuer             Asset issuer account, null for the native asset
 * @param destination             Receiver wallet account id
 * @param status                  Current status
 * @param statusHistory           Ordered status log
 * @param ledgerTransactionHash   Hash of the last submitted transaction, null before submission
 * @param submissionAttempts      Number of submission attempts made
 * @param lastErrorClassification Classification of the last submission error, if any
 * @param createdAt               Timestamp when payment was created
 * @param updatedAt               Timestamp of last update
 */
public record PaymentResponse(
        UUID id,
        String tenantId,
        PaymentType type,
        BigDecimal amount,
        String assetCode,
        String assetIssuer,
        String destination,
        PaymentStatus status,
        List<PaymentStatusHistoryDTO> statusHistory,
        String ledgerTransactionHash,
        Integer submissionAttempts,
        String lastErrorClassification,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
