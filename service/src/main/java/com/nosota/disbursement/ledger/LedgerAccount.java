package com.nosota.disbursement.ledger;

/**
 * Ledger-side state of an account.
 *
 * @param accountId      Account id
 * @param sequenceNumber Last consumed sequence number
 */
public record LedgerAccount(String accountId, long sequenceNumber) {
}
