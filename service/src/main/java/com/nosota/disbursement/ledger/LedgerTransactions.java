package com.nosota.disbursement.ledger;

import org.stellar.sdk.Account;
import org.stellar.sdk.AccountMergeOperation;
import org.stellar.sdk.Asset;
import org.stellar.sdk.AssetTypeNative;
import org.stellar.sdk.CreateAccountOperation;
import org.stellar.sdk.KeyPair;
import org.stellar.sdk.LedgerBounds;
import org.stellar.sdk.Network;
import org.stellar.sdk.Operation;
import org.stellar.sdk.PaymentOperation;
import org.stellar.sdk.TimeBounds;
import org.stellar.sdk.Transaction;
import org.stellar.sdk.TransactionBuilder;
import org.stellar.sdk.TransactionPreconditions;
import org.stellar.sdk.xdr.DecoratedSignature;
import org.stellar.sdk.xdr.Signature;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds and inspects SDK transactions the way every submitter path needs them: fee per operation,
 * an upper time bound and an optional upper ledger bound.
 */
public final class LedgerTransactions {

    private LedgerTransactions() {
    }

    /**
     * Starts a transaction consuming the next sequence number of {@code source}.
     *
     * @param network   Network the signatures are bound to
     * @param source    Current ledger state of the transaction source account
     * @param baseFee   Fee per operation, in stroops
     * @param maxTime   Latest close time (epoch seconds), 0 for unbounded
     * @param maxLedger Last ledger that may include the transaction, null for unbounded
     */
    public static TransactionBuilder builder(Network network, LedgerAccount source, long baseFee,
                                             long maxTime, Long maxLedger) {
        TransactionPreconditions.TransactionPreconditionsBuilder preconditions = TransactionPreconditions.builder()
                .timeBounds(new TimeBounds(0, maxTime));
        if (maxLedger != null) {
            preconditions.ledgerBounds(LedgerBounds.builder().minLedger(0).maxLedger(maxLedger).build());
        }
        // TransactionBuilder increments the account sequence on build
        return new TransactionBuilder(new Account(source.accountId(), source.sequenceNumber()), network)
                .setBaseFee(baseFee)
                .addPreconditions(preconditions.build());
    }

    public static CreateAccountOperation createAccount(String destination, BigDecimal startingBalance) {
        return new CreateAccountOperation.Builder(destination, amount(startingBalance)).build();
    }

    /**
     * @param source Operation source, null to use the transaction source
     * @param issuer Asset issuer, null for the native asset
     */
    public static PaymentOperation payment(String source, String destination, String assetCode, String issuer,
                                           BigDecimal amount) {
        Asset asset = issuer == null ? new AssetTypeNative() : Asset.create(assetCode + ":" + issuer);
        PaymentOperation.Builder builder = new PaymentOperation.Builder(destination, asset, amount(amount));
        if (source != null) {
            builder.setSourceAccount(source);
        }
        return builder.build();
    }

    /**
     * @param source Account merged away, null to merge the transaction source
     */
    public static AccountMergeOperation accountMerge(String source, String destination) {
        AccountMergeOperation.Builder builder = new AccountMergeOperation.Builder(destination);
        if (source != null) {
            builder.setSourceAccount(source);
        }
        return builder.build();
    }

    /**
     * Accounts whose signature the ledger requires: the transaction source and every explicit operation source.
     */
    public static Set<String> requiredSigners(Transaction transaction) {
        Set<String> signers = new LinkedHashSet<>();
        signers.add(transaction.getSourceAccount());
        for (Operation operation : transaction.getOperations()) {
            if (operation.getSourceAccount() != null) {
                signers.add(operation.getSourceAccount());
            }
        }
        return signers;
    }

    /**
     * Whether the transaction carries a valid signature of {@code accountId} over its hash.
     */
    public static boolean isSignedBy(Transaction transaction, String accountId) {
        KeyPair keyPair = KeyPair.fromAccountId(accountId);
        byte[] hint = keyPair.getSignatureHint().getSignatureHint();
        byte[] hash = transaction.hash();
        for (DecoratedSignature signature : transaction.getSignatures()) {
            if (Arrays.equals(hint, signature.getHint().getSignatureHint())
                    && keyPair.verify(hash, signature.getSignature().getSignature())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Wraps a signature produced outside the SDK (custodian) for {@link Transaction#addSignature}.
     */
    public static DecoratedSignature decorated(String accountId, byte[] signature) {
        DecoratedSignature decorated = new DecoratedSignature();
        decorated.setHint(KeyPair.fromAccountId(accountId).getSignatureHint());
        decorated.setSignature(new Signature(signature));
        return decorated;
    }

    private static String amount(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
