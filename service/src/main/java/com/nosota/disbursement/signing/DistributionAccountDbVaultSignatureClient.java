package com.nosota.disbursement.signing;

import com.nosota.disbursement.crypto.EncryptedKey;
import com.nosota.disbursement.crypto.PrivateKeyEncrypter;
import com.nosota.disbursement.model.DistributionAccountVaultEntry;
import com.nosota.disbursement.repository.DistributionAccountVaultRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Database vault backend for self-custodied tenant distribution accounts.
 */
public class DistributionAccountDbVaultSignatureClient extends DbVaultSignatureClient {

    private final DistributionAccountVaultRepository vaultRepository;

    public DistributionAccountDbVaultSignatureClient(String networkPassphrase,
                                                     String encryptionPassphrase,
                                                     PrivateKeyEncrypter encrypter,
                                                     DistributionAccountVaultRepository vaultRepository) {
        super(networkPassphrase, encryptionPassphrase, encrypter);
        this.vaultRepository = vaultRepository;
    }

    @Override
    protected Optional<EncryptedKey> loadKey(String publicKey) {
        return vaultRepository.findById(publicKey)
                .map(entry -> new EncryptedKey(entry.getEncryptedPrivateKey(), entry.getEncryptionSalt()));
    }

    @Override
    protected void storeKeys(List<VaultKey> keys) {
        LocalDateTime now = LocalDateTime.now();
        vaultRepository.saveAll(keys.stream()
                .map(key -> new DistributionAccountVaultEntry(
                        key.publicKey(), key.encryptedKey().cipherText(), key.encryptedKey().salt(), now))
                .toList());
    }

    @Override
    protected void removeKey(String publicKey) {
        vaultRepository.deleteById(publicKey);
    }

    @Override
    public SignatureClientType type() {
        return SignatureClientType.DISTRIBUTION_ACCOUNT_DB_VAULT;
    }
}
