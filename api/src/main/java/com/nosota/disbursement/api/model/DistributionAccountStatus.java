package com.nosota.disbursement.api.model;

/**
 * Provisioning status of a distribution account.
 */
public enum DistributionAccountStatus {
    ACTIVE,
    PENDING_FUNDING,
    DISABLED
}
