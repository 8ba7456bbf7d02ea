package com.nosota.disbursement.signing;

import com.nosota.disbursement.error.SignatureException;
import com.nosota.disbursement.error.SignatureServiceConfigurationException;
import com.nosota.disbursement.error.UnsupportedSignatureOperationException;
import com.nosota.disbursement.ledger.LedgerTransactions;
import lombok.extern.slf4j.Slf4j;
import org.stellar.sdk.KeyPair;
import org.stellar.sdk.Transaction;

import java.util.List;

/**
 * Signs with a single key supplied through process configuration (host account or platform
 * distribution account). Only signs for its own account.
 */
@Slf4j
public class AccountEnvSignatureClient implements SignatureClient {

    private final String networkPassphrase;
    private final KeyPair keyPair;
    private final SignatureClientType type;

    public AccountEnvSignatureClient(String networkPassphrase, String secretSeed, SignatureClientType type) {
        if (networkPassphrase == null || networkPassphrase.isBlank()) {
            throw new SignatureServiceConfigurationException("Network passphrase cannot be empty for " + type);
        }
        if (secretSeed == null || secretSeed.isBlank()) {
            throw new SignatureServiceConfigurationException("Secret seed cannot be empty for " + type);
        }
        try {
            this.keyPair = KeyPair.fromSecretSeed(secretSeed);
        } catch (RuntimeException e) {
            throw new SignatureServiceConfigurationException("Invalid secret seed for " + type, e);
        }
        this.networkPassphrase = networkPassphrase;
        this.type = type;
    }

    public String getAccountId() {
        return keyPair.getAccountId();
    }

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
            throw new SignatureException("Transaction network passphrase does not match " + type);
        }

        for (String account : accounts) {
            if (!keyPair.getAccountId().equals(account)) {
                throw new SignatureException(String.format(
                        "Account %s is not the account configured for %s (%s)", account, type, keyPair.getAccountId()));
            }
            if (!LedgerTransactions.isSignedBy(transaction, account)) {
                transaction.sign(keyPair);
            }
        }
        return transaction;
    }

    @Override
    public List<String> batchInsert(int number) throws UnsupportedSignatureOperationException {
        throw new UnsupportedSignatureOperationException(type + " has a single configured key, batch insert is not applicable");
    }

    @Override
    public void delete(String publicKey) throws UnsupportedSignatureOperationException {
        throw new UnsupportedSignatureOperationException(type + " has a single configured key, delete is not applicable");
    }

    @Override
    public SignatureClientType type() {
        return type;
    }
}
