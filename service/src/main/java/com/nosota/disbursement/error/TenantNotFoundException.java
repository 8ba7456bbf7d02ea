package com.nosota.disbursement.error;

public class TenantNotFoundException extends Exception {
    public TenantNotFoundException() {
    }

    public TenantNotFoundException(String message) {
        super(message);
    }

    public TenantNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public TenantNotFoundException(Throwable cause) {
        super(cause);
    }

    public TenantNotFoundException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
