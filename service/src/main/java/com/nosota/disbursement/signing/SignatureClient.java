package com.nosota.disbursement.signing;

import com.nosota.disbursement.error.SignatureException;
import com.nosota.disbursement.error.UnsupportedSignatureOperationException;
import org.stellar.sdk.Transaction;

import java.util.List;

/**
 * Uniform signing contract over the different key custody models.
 *
 * <p>Every backend signs. Key provisioning and deletion are optional capabilities: backends that
 * have nothing to provision throw {@link UnsupportedSignatureOperationException}, which callers
 * treat as "not applicable" rather than as a failure.
 */
public interface SignatureClient {

    /**
     * @return Passphrase of the network this client signs for
     */
    String networkPassphrase();

    /**
     * Adds one signature per account to the transaction. Accounts that already signed are skipped.
     *
     * @param transaction Transaction to sign, bound to {@link #networkPassphrase()}
     * @param accounts    Accounts whose keys must sign
     * @return The same transaction, carrying the added signatures
     * @throws SignatureException when an account is unknown to this backend or signing fails
     */
    Transaction sign(Transaction transaction, String... accounts) throws SignatureException;

    /**
     * Generates and stores new keys.
     *
     * @param number Number of keys to generate
     * @return Public keys of the stored keys
     */
    List<String> batchInsert(int number) throws SignatureException, UnsupportedSignatureOperationException;

    /**
     * Removes a stored key.
     */
    void delete(String publicKey) throws SignatureException, UnsupportedSignatureOperationException;

    SignatureClientType type();
}
