package com.nosota.disbursement.model;

import com.nosota.disbursement.api.model.PaymentStatus;
import com.nosota.disbursement.api.model.PaymentType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Payment entity - one transfer from a tenant's distribution account to a receiver wallet.
 *
 * <p>Owned by the disbursement subsystem; this service claims READY payments and writes the
 * submission related fields (status, transaction hash, attempts, last error).
 *
 * <p><b>Status graph:</b>
 * <pre>
 * DRAFT -> READY -> PENDING -> SUCCESS
 *                          \-> FAILED -> READY (retry)
 * READY, PENDING -> CANCELED
 * PENDING -> READY (transient failure requeue)
 * </pre>
 */
@Entity
@Table(name = "payments")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Tenant whose distribution account funds this payment.
     */
    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    /**
     * Disbursement this payment belongs to, null for direct payments.
     */
    @Column(name = "disbursement_id")
    private UUID disbursementId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false)
    private PaymentType type;

    @Column(name = "amount", nullable = false, precision = 19, scale = 7)
    private BigDecimal amount;

    /**
     * Asset code. With a null issuer the payment is made in the native asset.
     */
    @Column(name = "asset_code", nullable = false, length = 12)
    private String assetCode;

    @Column(name = "asset_issuer", length = 56)
    private String assetIssuer;

    /**
     * Receiver wallet account id.
     */
    @Column(name = "destination", nullable = false, length = 56)
    private String destination;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private PaymentStatus status;

    /**
     * Append-only log of status changes.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "status_history", nullable = false, columnDefinition = "jsonb")
    private List<PaymentStatusHistoryEntry> statusHistory = new ArrayList<>();

    /**
     * Hash of the last transaction built for this payment.
     * Written before submission so an interrupted attempt can be reconciled against the ledger.
     */
    @Column(name = "ledger_transaction_hash", length = 64)
    private String ledgerTransactionHash;

    @Column(name = "submission_attempts", nullable = false)
    private Integer submissionAttempts = 0;

    /**
     * Classification of the last submission error (ledger result code, HTTP status or network error).
     */
    @Column(name = "last_error_classification")
    private String lastErrorClassification;

    /**
     * Channel account used by the last submission attempt.
     */
    @Column(name = "channel_account", length = 56)
    private String channelAccount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isNativeAsset() {
        return assetIssuer == null || assetIssuer.isBlank();
    }
}
