package com.nosota.disbursement.signing;

/**
 * Signature backend implementations.
 */
public enum SignatureClientType {
    CHANNEL_ACCOUNT_DB,
    HOST_ENV,
    DISTRIBUTION_ACCOUNT_ENV,
    DISTRIBUTION_ACCOUNT_DB_VAULT,
    DISTRIBUTION_ACCOUNT_CUSTODIAL
}
