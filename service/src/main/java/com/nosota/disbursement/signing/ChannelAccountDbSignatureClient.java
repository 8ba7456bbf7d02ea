package com.nosota.disbursement.signing;

import com.nosota.disbursement.api.model.ChannelAccountState;
import com.nosota.disbursement.crypto.EncryptedKey;
import com.nosota.disbursement.crypto.PrivateKeyEncrypter;
import com.nosota.disbursement.model.ChannelAccount;
import com.nosota.disbursement.repository.ChannelAccountRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Database vault backend over the {@code channel_accounts} table.
 *
 * <p>Inserted accounts are stored LEASED: they cannot be picked by the submitter until their
 * activation transaction succeeds and the pool manager releases them.
 */
public class ChannelAccountDbSignatureClient extends DbVaultSignatureClient {

    private final ChannelAccountRepository channelAccountRepository;

    public ChannelAccountDbSignatureClient(String networkPassphrase,
                                           String encryptionPassphrase,
                                           PrivateKeyEncrypter encrypter,
                                           ChannelAccountRepository channelAccountRepository) {
        super(networkPassphrase, encryptionPassphrase, encrypter);
        this.channelAccountRepository = channelAccountRepository;
    }

    @Override
    protected Optional<EncryptedKey> loadKey(String publicKey) {
        return channelAccountRepository.findById(publicKey)
                .map(account -> new EncryptedKey(account.getEncryptedPrivateKey(), account.getEncryptionSalt()));
    }

    @Override
    protected void storeKeys(List<VaultKey> keys) {
        LocalDateTime now = LocalDateTime.now();
        List<ChannelAccount> accounts = keys.stream()
                .map(key -> {
                    ChannelAccount account = new ChannelAccount();
                    account.setPublicKey(key.publicKey());
                    account.setEncryptedPrivateKey(key.encryptedKey().cipherText());
                    account.setEncryptionSalt(key.encryptedKey().salt());
                    account.setState(ChannelAccountState.LEASED);
                    account.setLeasedAt(now);
                    account.setCreatedAt(now);
                    account.setUpdatedAt(now);
                    return account;
                })
                .toList();
        channelAccountRepository.saveAll(accounts);
    }

    @Override
    protected void removeKey(String publicKey) {
        channelAccountRepository.deleteById(publicKey);
    }

    @Override
    public SignatureClientType type() {
        return SignatureClientType.CHANNEL_ACCOUNT_DB;
    }
}
