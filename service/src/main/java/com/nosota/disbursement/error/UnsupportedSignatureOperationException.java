package com.nosota.disbursement.error;

/**
 * Signals that a signature backend has nothing to do for the requested key operation
 * (batch provisioning or deletion on an environment key or a custodial account).
 * Callers treat it as "not applicable", distinct from a failure.
 */
public class UnsupportedSignatureOperationException extends Exception {
    public UnsupportedSignatureOperationException() {
    }

    public UnsupportedSignatureOperationException(String message) {
        super(message);
    }

    public UnsupportedSignatureOperationException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnsupportedSignatureOperationException(Throwable cause) {
        super(cause);
    }

    public UnsupportedSignatureOperationException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
