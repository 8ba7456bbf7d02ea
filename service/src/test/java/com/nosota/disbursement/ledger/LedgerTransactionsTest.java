package com.nosota.disbursement.ledger;

import org.junit.jupiter.api.Test;
import org.stellar.sdk.AssetTypeCreditAlphaNum;
import org.stellar.sdk.AssetTypeNative;
import org.stellar.sdk.KeyPair;
import org.stellar.sdk.Network;
import org.stellar.sdk.PaymentOperation;
import org.stellar.sdk.Transaction;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerTransactionsTest {

    private static final Network NETWORK = new Network("Test SDF Network ; September 2015");

    private final KeyPair source = KeyPair.random();
    private final KeyPair distribution = KeyPair.random();
    private final KeyPair issuer = KeyPair.random();

    private Transaction payment(long sequenceNumber, Network network, Long maxLedger) {
        return LedgerTransactions.builder(network, new LedgerAccount(source.getAccountId(), sequenceNumber),
                        100, 1_700_000_000L, maxLedger)
                .addOperation(LedgerTransactions.payment(distribution.getAccountId(), KeyPair.random().getAccountId(),
                        "XLM", null, new BigDecimal("10.5000000")))
                .build();
    }

    @Test
    void testConsumesNextSequenceNumberWithBounds() {
        Transaction transaction = payment(7, NETWORK, 1010L);

        assertThat(transaction.getSequenceNumber()).isEqualTo(8L);
        assertThat(transaction.getFee()).isEqualTo(100L);
        assertThat(transaction.getPreconditions().getLedgerBounds().getMaxLedger()).isEqualTo(1010L);
        assertThat(transaction.getPreconditions().getTimeBounds().getMaxTime())
                .isEqualTo(BigInteger.valueOf(1_700_000_000L));
    }

    @Test
    void testNoLedgerBoundWhenUnbounded() {
        assertThat(payment(7, NETWORK, null).getPreconditions().getLedgerBounds()).isNull();
    }

    @Test
    void testPaymentAsset() {
        PaymentOperation nativePayment = (PaymentOperation) payment(7, NETWORK, null).getOperations()[0];
        PaymentOperation creditPayment = LedgerTransactions.payment(null, KeyPair.random().getAccountId(),
                "USDC", issuer.getAccountId(), new BigDecimal("1.00"));

        assertThat(nativePayment.getAsset()).isInstanceOf(AssetTypeNative.class);
        assertThat(nativePayment.getAmount()).isEqualTo("10.5");
        assertThat(nativePayment.getSourceAccount()).isEqualTo(distribution.getAccountId());
        assertThat(creditPayment.getSourceAccount()).isNull();
        assertThat(creditPayment.getAmount()).isEqualTo("1");
        assertThat(((AssetTypeCreditAlphaNum) creditPayment.getAsset()).getCode()).isEqualTo("USDC");
        assertThat(((AssetTypeCreditAlphaNum) creditPayment.getAsset()).getIssuer()).isEqualTo(issuer.getAccountId());
    }

    @Test
    void testHashIsNetworkBound() {
        Transaction testnet = payment(7, NETWORK, 1010L);
        Transaction pubnet = payment(7, new Network("Public Global Stellar Network ; September 2015"), 1010L);

        assertThat(testnet.hashHex()).hasSize(64).isNotEqualTo(pubnet.hashHex());
    }

    @Test
    void testRequiredSigners() {
        assertThat(LedgerTransactions.requiredSigners(payment(7, NETWORK, null)))
                .containsExactly(source.getAccountId(), distribution.getAccountId());
    }

    @Test
    void testIsSignedBy() {
        Transaction transaction = payment(7, NETWORK, null);
        assertThat(LedgerTransactions.isSignedBy(transaction, source.getAccountId())).isFalse();

        transaction.sign(source);
        transaction.addSignature(LedgerTransactions.decorated(distribution.getAccountId(),
                KeyPair.random().sign(transaction.hash())));

        assertThat(LedgerTransactions.isSignedBy(transaction, source.getAccountId())).isTrue();
        // right hint, wrong key
        assertThat(LedgerTransactions.isSignedBy(transaction, distribution.getAccountId())).isFalse();
    }

    @Test
    void testSignatureFromAnotherNetworkDoesNotCount() {
        Transaction testnet = payment(7, NETWORK, 1010L);
        Transaction pubnet = payment(7, new Network("Public Global Stellar Network ; September 2015"), 1010L);
        testnet.addSignature(LedgerTransactions.decorated(source.getAccountId(), source.sign(pubnet.hash())));

        assertThat(LedgerTransactions.isSignedBy(testnet, source.getAccountId())).isFalse();
    }
}
