package com.nosota.disbursement.ledger;

import java.util.List;

/**
 * Outcome of a transaction included in a ledger.
 *
 * @param hash                 Transaction hash (hex)
 * @param successful           Whether the transaction was applied successfully
 * @param ledger               Ledger that included the transaction
 * @param resultCode           Transaction result code (tx_success, tx_failed, ...)
 * @param operationResultCodes Per operation result codes
 */
public record LedgerTransactionResult(
        String hash,
        boolean successful,
        Long ledger,
        String resultCode,
        List<String> operationResultCodes
) {
}
