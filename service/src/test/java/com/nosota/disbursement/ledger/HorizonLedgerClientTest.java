package com.nosota.disbursement.ledger;

import org.junit.jupiter.api.Test;
import org.stellar.sdk.KeyPair;
import org.stellar.sdk.Network;
import org.stellar.sdk.Server;
import org.stellar.sdk.Transaction;
import org.stellar.sdk.requests.AccountsRequestBuilder;
import org.stellar.sdk.requests.ErrorResponse;
import org.stellar.sdk.requests.LedgersRequestBuilder;
import org.stellar.sdk.requests.RequestBuilder;
import org.stellar.sdk.requests.TooManyRequestsException;
import org.stellar.sdk.responses.AccountResponse;
import org.stellar.sdk.responses.LedgerResponse;
import org.stellar.sdk.responses.Page;
import org.stellar.sdk.responses.SubmitTransactionResponse;
import org.stellar.sdk.responses.SubmitTransactionTimeoutResponseException;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HorizonLedgerClientTest {

    private final Server server = mock(Server.class);
    private final HorizonLedgerClient client = new HorizonLedgerClient(server);

    private final String channel = KeyPair.random().getAccountId();

    private Transaction payment() {
        return LedgerTransactions.builder(Network.TESTNET, new LedgerAccount(channel, 41), 100, 0, 1010L)
                .addOperation(LedgerTransactions.payment(null, KeyPair.random().getAccountId(), "XLM", null,
                        BigDecimal.TEN))
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void testLatestLedgerSequence() throws Exception {
        LedgersRequestBuilder ledgers = mock(LedgersRequestBuilder.class);
        Page<LedgerResponse> page = mock(Page.class);
        LedgerResponse ledger = mock(LedgerResponse.class);
        when(server.ledgers()).thenReturn(ledgers);
        when(ledgers.order(RequestBuilder.Order.DESC)).thenReturn(ledgers);
        when(ledgers.limit(1)).thenReturn(ledgers);
        when(ledgers.execute()).thenReturn(page);
        when(page.getRecords()).thenReturn(new ArrayList<>(List.of(ledger)));
        when(ledger.getSequence()).thenReturn(1234L);

        assertThat(client.getLatestLedgerSequence()).isEqualTo(1234L);
    }

    @Test
    void testAccountNotFound() throws Exception {
        AccountsRequestBuilder accounts = mock(AccountsRequestBuilder.class);
        when(server.accounts()).thenReturn(accounts);
        when(accounts.account(channel)).thenThrow(new ErrorResponse(404, "{\"status\":404}"));

        assertThatThrownBy(() -> client.getAccount(channel))
                .isInstanceOfSatisfying(LedgerException.class, e -> assertThat(e.isNotFound()).isTrue());
    }

    @Test
    void testAccount() throws Exception {
        AccountsRequestBuilder accounts = mock(AccountsRequestBuilder.class);
        AccountResponse response = mock(AccountResponse.class);
        when(server.accounts()).thenReturn(accounts);
        when(accounts.account(channel)).thenReturn(response);
        when(response.getAccountId()).thenReturn(channel);
        when(response.getSequenceNumber()).thenReturn(77L);

        assertThat(client.getAccount(channel)).isEqualTo(new LedgerAccount(channel, 77L));
    }

    @Test
    void testSubmitSuccess() throws Exception {
        Transaction transaction = payment();
        SubmitTransactionResponse response = mock(SubmitTransactionResponse.class);
        when(server.submitTransaction(transaction, true)).thenReturn(response);
        when(response.isSuccess()).thenReturn(true);
        when(response.getHash()).thenReturn(transaction.hashHex());
        when(response.getLedger()).thenReturn(1005L);

        LedgerTransactionResult result = client.submitTransaction(transaction);

        assertThat(result.successful()).isTrue();
        assertThat(result.hash()).isEqualTo(transaction.hashHex());
        assertThat(result.ledger()).isEqualTo(1005L);
    }

    @Test
    void testSubmitRejectedCarriesResultCodes() throws Exception {
        Transaction transaction = payment();
        SubmitTransactionResponse response = mock(SubmitTransactionResponse.class, RETURNS_DEEP_STUBS);
        when(server.submitTransaction(transaction, true)).thenReturn(response);
        when(response.isSuccess()).thenReturn(false);
        when(response.getExtras().getResultCodes()).thenReturn(new SubmitTransactionResponse.Extras.ResultCodes(
                "tx_failed", null, new ArrayList<>(List.of("op_no_destination"))));

        assertThatThrownBy(() -> client.submitTransaction(transaction))
                .isInstanceOfSatisfying(LedgerException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(400);
                    assertThat(e.hasResultCodes()).isTrue();
                    assertThat(e.classification()).isEqualTo("op_no_destination");
                    assertThat(e.isPermanentRejection()).isTrue();
                });
    }

    @Test
    void testIndeterminateSubmissionErrors() throws Exception {
        Transaction transaction = payment();
        when(server.submitTransaction(transaction, true))
                .thenThrow(new SubmitTransactionTimeoutResponseException())
                .thenThrow(new TooManyRequestsException(5))
                .thenThrow(new IOException("connection reset"));

        assertThatThrownBy(() -> client.submitTransaction(transaction))
                .isInstanceOfSatisfying(LedgerException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(504);
                    assertThat(e.hasResultCodes()).isFalse();
                });
        assertThatThrownBy(() -> client.submitTransaction(transaction))
                .isInstanceOfSatisfying(LedgerException.class, e -> assertThat(e.getStatusCode()).isEqualTo(429));
        assertThatThrownBy(() -> client.submitTransaction(transaction))
                .isInstanceOfSatisfying(LedgerException.class,
                        e -> assertThat(e.classification()).isEqualTo("network_error"));
    }
}
