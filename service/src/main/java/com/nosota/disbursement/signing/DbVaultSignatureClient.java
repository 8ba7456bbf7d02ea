package com.nosota.disbursement.signing;

import com.nosota.disbursement.crypto.EncryptedKey;
import com.nosota.disbursement.crypto.KeyEncryptionException;
import com.nosota.disbursement.crypto.PrivateKeyEncrypter;
import com.nosota.disbursement.error.SignatureException;
import com.nosota.disbursement.error.SignatureServiceConfigurationException;
import com.nosota.disbursement.ledger.LedgerTransactions;
import lombok.extern.slf4j.Slf4j;
import org.stellar.sdk.KeyPair;
import org.stellar.sdk.Transaction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base of the database vault backends: keys are encrypted at rest and decrypted just in time
 * for each signature. Decrypted keys are not retained.
 */
@Slf4j
public abstract class DbVaultSignatureClient implements SignatureClient {

    /**
     * Freshly generated key ready to be stored.
     */
    protected record VaultKey(String publicKey, EncryptedKey encryptedKey) {
    }

    private final String networkPassphrase;
    private final String encryptionPassphrase;
    private final PrivateKeyEncrypter encrypter;

    protected DbVaultSignatureClient(String networkPassphrase, String encryptionPassphrase, PrivateKeyEncrypter encrypter) {
        if (networkPassphrase == null || networkPassphrase.isBlank()) {
            throw new SignatureServiceConfigurationException("Network passphrase cannot be empty for " + type());
        }
        if (encryptionPassphrase == null || encryptionPassphrase.isBlank()) {
            throw new SignatureServiceConfigurationException("Encryption passphrase cannot be empty for " + type());
        }
        this.networkPassphrase = networkPassphrase;
        this.encryptionPassphrase = encryptionPassphrase;
        this.encrypter = encrypter;
    }

    protected abstract Optional<EncryptedKey> loadKey(String publicKey);

    protected abstract void storeKeys(List<VaultKey> keys);

    protected abstract void removeKey(String publicKey) throws SignatureException;

    @Override
    public String networkPassphrase() {
        return networkPassphrase;
    }

    @Override
    public Transaction sign(Transaction transaction, String... accounts) throws SignatureException {
        if (transaction == null) {
            throw new SignatureException("Transaction cannot be null");
        }
        if (!networkPassphrase.equals(transaction.getNetwork().getNetworkPassphrase())) {
            throw new SignatureException("Transaction network passphrase does not match " + type());
        }

        for (String account : accounts) {
            if (LedgerTransactions.isSignedBy(transaction, account)) {
                continue;
            }
            EncryptedKey encryptedKey = loadKey(account)
                    .orElseThrow(() -> new SignatureException(
                            String.format("Account %s is not stored in %s", account, type())));

            KeyPair keyPair;
            try {
                keyPair = KeyPair.fromSecretSeed(encrypter.decrypt(encryptedKey, encryptionPassphrase));
            } catch (KeyEncryptionException e) {
                throw new SignatureException("Unable to decrypt key of account " + account, e);
            }
            if (!keyPair.getAccountId().equals(account)) {
                throw new SignatureException("Stored key does not belong to account " + account);
            }
            transaction.sign(keyPair);
        }
        return transaction;
    }

    @Override
    public List<String> batchInsert(int number) throws SignatureException {
        if (number < 1) {
            throw new SignatureException("Number of keys to insert must be positive, got " + number);
        }

        List<VaultKey> keys = new ArrayList<>(number);
        for (int i = 0; i < number; i++) {
            KeyPair keyPair = KeyPair.random();
            EncryptedKey encryptedKey = encrypter.encrypt(new String(keyPair.getSecretSeed()), encryptionPassphrase);
            keys.add(new VaultKey(keyPair.getAccountId(), encryptedKey));
        }
        storeKeys(keys);

        log.info("Inserted keys into vault: type={}, count={}", type(), keys.size());
        return keys.stream().map(VaultKey::publicKey).toList();
    }

    @Override
    public void delete(String publicKey) throws SignatureException {
        removeKey(publicKey);
        log.info("Deleted key from vault: type={}, publicKey={}", type(), publicKey);
    }
}
