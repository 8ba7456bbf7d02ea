package com.nosota.disbursement.api.model;

/**
 * Custody model of a tenant's distribution account.
 * The type decides which signature backend authorizes the account's payment operations.
 */
public enum DistributionAccountType {
    /**
     * Self-custody, single key supplied through process configuration.
     */
    STELLAR_ENV,

    /**
     * Self-custody, key encrypted at rest in the database vault.
     */
    STELLAR_DB_VAULT,

    /**
     * Funds held by a third-party custodian that signs on the account's behalf.
     */
    CUSTODIAL;

    public boolean isSelfCustody() {
        return this != CUSTODIAL;
    }
}
