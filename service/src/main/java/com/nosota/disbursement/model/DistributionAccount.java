package com.nosota.disbursement.model;

import com.nosota.disbursement.api.model.DistributionAccountStatus;
import com.nosota.disbursement.api.model.DistributionAccountType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Distribution account entity - the ledger account that funds a tenant's payments.
 *
 * <p>At most one ACTIVE account per tenant (enforced by a partial unique index).
 * Key material of STELLAR_DB_VAULT accounts lives in {@link DistributionAccountVaultEntry}.
 */
@Entity
@Table(name = "distribution_accounts")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class DistributionAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "public_key", nullable = false, length = 56)
    private String publicKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false)
    private DistributionAccountType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private DistributionAccountStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
