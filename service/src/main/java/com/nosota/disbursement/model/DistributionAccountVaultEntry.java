package com.nosota.disbursement.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Encrypted key of a self-custodied distribution account kept in the database vault.
 */
@Entity
@Table(name = "distribution_account_vault")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class DistributionAccountVaultEntry {

    @Id
    @Column(name = "public_key", length = 56, updatable = false, nullable = false)
    private String publicKey;

    @Column(name = "encrypted_private_key", nullable = false, columnDefinition = "TEXT")
    private String encryptedPrivateKey;

    @Column(name = "encryption_salt", nullable = false)
    private String encryptionSalt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
