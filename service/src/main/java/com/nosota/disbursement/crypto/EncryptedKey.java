package com.nosota.disbursement.crypto;

/**
 * Encrypted secret as persisted: Base64 of IV + ciphertext, and Base64 of the key derivation salt.
 */
public record EncryptedKey(String cipherText, String salt) {
}
