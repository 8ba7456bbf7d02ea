package com.nosota.disbursement.error;

/**
 * Thrown when a tenant has no active distribution account.
 * Never answered with a fallback account, so funds are not attributed to the wrong tenant.
 */
public class DistributionAccountNotFoundException extends Exception {
    public DistributionAccountNotFoundException() {
    }

    public DistributionAccountNotFoundException(String message) {
        super(message);
    }

    public DistributionAccountNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public DistributionAccountNotFoundException(Throwable cause) {
        super(cause);
    }

    public DistributionAccountNotFoundException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
