package com.nosota.disbursement.crypto;

/**
 * Encryption or decryption of key material failed (wrong passphrase, corrupted row, missing algorithm).
 */
public class KeyEncryptionException extends RuntimeException {
    public KeyEncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
