package com.nosota.disbursement.model;

import com.nosota.disbursement.api.model.ChannelAccountState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Channel account entity - an auxiliary ledger identity used as transaction source.
 *
 * <p>Each channel account has its own sequence number on the ledger, so N free channel
 * accounts allow N transactions to be in flight at the same time while the distribution
 * account only authorizes the payment operations.
 *
 * <p><b>Lease lifecycle:</b>
 * <pre>
 * FREE --lease--> LEASED --release--> FREE
 * FREE --delete--> PENDING_DELETION --(merged on ledger)--> row removed
 * </pre>
 * A freshly created account is stored LEASED until its activation transaction succeeds.
 */
@Entity
@Table(name = "channel_accounts")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ChannelAccount {

    /**
     * Ledger account id (G... address).
     */
    @Id
    @Column(name = "public_key", length = 56, updatable = false, nullable = false)
    private String publicKey;

    /**
     * Secret seed encrypted with AES-GCM, IV prepended, Base64.
     */
    @Column(name = "encrypted_private_key", nullable = false, columnDefinition = "TEXT")
    private String encryptedPrivateKey;

    /**
     * Salt of the passphrase-derived encryption key, Base64.
     */
    @Column(name = "encryption_salt", nullable = false)
    private String encryptionSalt;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false)
    private ChannelAccountState state;

    /**
     * Timestamp when the current lease was taken.
     * Used by the lease sweep to detect leases abandoned by a crashed worker.
     */
    @Column(name = "leased_at")
    private LocalDateTime leasedAt;

    /**
     * Last ledger on which a transaction built under the current lease can be included. Once a later
     * ledger has closed, the lease may be taken over by another payment.
     */
    @Column(name = "locked_until_ledger_number")
    private Long lockedUntilLedgerNumber;

    /**
     * Payment currently paired with this account, null for activation and deletion leases.
     */
    @Column(name = "leased_by_payment_id")
    private UUID leasedByPaymentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isFree() {
        return state == ChannelAccountState.FREE;
    }

    public boolean isLeased() {
        return state == ChannelAccountState.LEASED;
    }
}
