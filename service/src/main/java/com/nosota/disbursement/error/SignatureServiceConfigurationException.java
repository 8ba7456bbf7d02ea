package com.nosota.disbursement.error;

/**
 * Misconfigured signature service (missing signer, mismatched network passphrases, invalid key).
 * Fatal at startup, never retried.
 */
public class SignatureServiceConfigurationException extends RuntimeException {
    public SignatureServiceConfigurationException(String message) {
        super(message);
    }

    public SignatureServiceConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
