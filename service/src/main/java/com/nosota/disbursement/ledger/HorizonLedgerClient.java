package com.nosota.disbursement.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.stellar.sdk.AccountRequiresMemoException;
import org.stellar.sdk.Server;
import org.stellar.sdk.Transaction;
import org.stellar.sdk.requests.ErrorResponse;
import org.stellar.sdk.requests.RequestBuilder;
import org.stellar.sdk.requests.TooManyRequestsException;
import org.stellar.sdk.responses.AccountResponse;
import org.stellar.sdk.responses.LedgerResponse;
import org.stellar.sdk.responses.Page;
import org.stellar.sdk.responses.SubmitTransactionResponse;
import org.stellar.sdk.responses.SubmitTransactionTimeoutResponseException;
import org.stellar.sdk.responses.SubmitTransactionUnknownResponseException;
import org.stellar.sdk.responses.TransactionResponse;

import java.io.IOException;
import java.util.List;

/**
 * {@link LedgerClient} over a Horizon {@link Server}.
 *
 * <p>Horizon error types become {@link LedgerException}s: HTTP errors keep their status, a rejected
 * submission becomes a 400 carrying the result codes, a submission timeout a 504 and an I/O failure
 * {@link LedgerException#NO_RESPONSE}.
 *
 * <p>NOT a Spring @Component: registered by {@code LedgerClientConfig}.
 */
@RequiredArgsConstructor
@Slf4j
public class HorizonLedgerClient implements LedgerClient {

    static final String TX_SUCCESS = "tx_success";
    static final String TX_FAILED = "tx_failed";

    private final Server server;

    @Override
    public long getLatestLedgerSequence() throws LedgerException {
        Page<LedgerResponse> page = call("get latest ledger", () -> server.ledgers()
                .order(RequestBuilder.Order.DESC)
                .limit(1)
                .execute());
        if (page.getRecords() == null || page.getRecords().isEmpty()) {
            throw new LedgerException("get latest ledger returned no ledgers", 502);
        }
        return page.getRecords().get(0).getSequence();
    }

    @Override
    public LedgerAccount getAccount(String accountId) throws LedgerException {
        AccountResponse account = call("get account " + accountId, () -> server.accounts().account(accountId));
        return new LedgerAccount(account.getAccountId(), account.getSequenceNumber());
    }

    @Override
    public LedgerTransactionResult submitTransaction(Transaction transaction) throws LedgerException {
        String hash = transaction.hashHex();
        log.debug("Submitting transaction: hash={}, source={}, signatures={}",
                hash, transaction.getSourceAccount(), transaction.getSignatures().size());

        SubmitTransactionResponse response = call("submit transaction " + hash,
                () -> server.submitTransaction(transaction, true));
        if (response.isSuccess()) {
            return new LedgerTransactionResult(response.getHash(), true, response.getLedger(), TX_SUCCESS, List.of());
        }

        String resultCode = null;
        List<String> operationResultCodes = List.of();
        if (response.getExtras() != null && response.getExtras().getResultCodes() != null) {
            SubmitTransactionResponse.Extras.ResultCodes codes = response.getExtras().getResultCodes();
            resultCode = codes.getTransactionResultCode();
            if (codes.getOperationsResultCodes() != null) {
                operationResultCodes = List.copyOf(codes.getOperationsResultCodes());
            }
        }

        StringBuilder message = new StringBuilder("submit transaction ").append(hash)
                .append(" failed: StatusCode=400");
        if (resultCode != null) {
            message.append(", ResultCode=").append(resultCode);
        }
        if (!operationResultCodes.isEmpty()) {
            message.append(", OperationResultCodes=").append(operationResultCodes);
        }
        throw new LedgerException(message.toString(), 400, resultCode, operationResultCodes);
    }

    @Override
    public LedgerTransactionResult getTransaction(String hash) throws LedgerException {
        TransactionResponse response = call("get transaction " + hash, () -> server.transactions().transaction(hash));
        boolean successful = Boolean.TRUE.equals(response.getSuccessful());
        return new LedgerTransactionResult(response.getHash(), successful, response.getLedger(),
                successful ? TX_SUCCESS : TX_FAILED, List.of());
    }

    @FunctionalInterface
    interface HorizonCall<T> {
        T execute() throws IOException, AccountRequiresMemoException;
    }

    private <T> T call(String operation, HorizonCall<T> request) throws LedgerException {
        T result;
        try {
            result = request.execute();
        } catch (ErrorResponse e) {
            throw new LedgerException(operation + " failed: StatusCode=" + e.getCode(), e.getCode(), e);
        } catch (TooManyRequestsException e) {
            throw new LedgerException(operation + " rate limited", 429, e);
        } catch (SubmitTransactionTimeoutResponseException e) {
            throw new LedgerException(operation + " timed out", 504, e);
        } catch (SubmitTransactionUnknownResponseException e) {
            throw new LedgerException(operation + " failed: StatusCode=" + e.getCode(), e.getCode(), e);
        } catch (AccountRequiresMemoException e) {
            throw new LedgerException(operation + " rejected: destination " + e.getAccountId() + " requires a memo", 400, e);
        } catch (IOException e) {
            throw new LedgerException(operation + " failed: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new LedgerException(operation + " returned an empty body", 502);
        }
        return result;
    }
}
