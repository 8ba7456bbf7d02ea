package com.nosota.disbursement.ledger;

import org.stellar.sdk.Transaction;

/**
 * Client of the distributed ledger's public API.
 *
 * <p>Implementations are stateless and safe to call from any number of submitter workers.
 */
public interface LedgerClient {

    /**
     * @return Sequence number of the latest closed ledger
     */
    long getLatestLedgerSequence() throws LedgerException;

    /**
     * @param accountId Account id
     * @return Account state
     * @throws LedgerException with status 404 when the account does not exist
     */
    LedgerAccount getAccount(String accountId) throws LedgerException;

    /**
     * Submits a signed transaction and waits for it to be included in a ledger.
     *
     * @param transaction Signed transaction
     * @return Result of a successful transaction
     * @throws LedgerException when the transaction is rejected or the outcome is unknown
     */
    LedgerTransactionResult submitTransaction(Transaction transaction) throws LedgerException;

    /**
     * @param hash Transaction hash (hex)
     * @return Result of the included transaction, successful or not
     * @throws LedgerException with status 404 when the ledger does not know the transaction
     */
    LedgerTransactionResult getTransaction(String hash) throws LedgerException;
}
