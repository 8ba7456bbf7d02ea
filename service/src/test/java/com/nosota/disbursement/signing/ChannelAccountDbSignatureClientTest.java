package com.nosota.disbursement.signing;

import com.nosota.disbursement.api.model.ChannelAccountState;
import com.nosota.disbursement.crypto.PrivateKeyEncrypter;
import com.nosota.disbursement.error.SignatureException;
import com.nosota.disbursement.ledger.LedgerAccount;
import com.nosota.disbursement.ledger.LedgerTransactions;
import com.nosota.disbursement.model.ChannelAccount;
import com.nosota.disbursement.repository.ChannelAccountRepository;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.stellar.sdk.KeyPair;
import org.stellar.sdk.Network;
import org.stellar.sdk.Transaction;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChannelAccountDbSignatureClientTest {

    private static final String NETWORK = "Test SDF Network ; September 2015";

    private final ChannelAccountRepository repository = mock(ChannelAccountRepository.class);
    private final ChannelAccountDbSignatureClient client =
            new ChannelAccountDbSignatureClient(NETWORK, "passphrase", new PrivateKeyEncrypter(), repository);

    private static Transaction mergeFrom(String account) {
        return LedgerTransactions.builder(new Network(NETWORK), new LedgerAccount(account, 1), 100, 0, null)
                .addOperation(LedgerTransactions.accountMerge(null, KeyPair.random().getAccountId()))
                .build();
    }

    @SuppressWarnings("unchecked")
    private List<ChannelAccount> insert(int count) throws Exception {
        List<String> publicKeys = client.batchInsert(count);
        ArgumentCaptor<List<ChannelAccount>> captor = ArgumentCaptor.forClass(List.class);
        verify(repository).saveAll(captor.capture());
        assertThat(captor.getValue()).extracting(ChannelAccount::getPublicKey).containsExactlyElementsOf(publicKeys);
        return captor.getValue();
    }

    @Test
    void testInsertedAccountsAreLeasedAndEncrypted() throws Exception {
        List<ChannelAccount> stored = insert(3);

        assertThat(stored).hasSize(3);
        assertThat(stored).allMatch(a -> a.getState() == ChannelAccountState.LEASED);
        assertThat(stored).allMatch(a -> a.getEncryptedPrivateKey() != null && a.getEncryptionSalt() != null);
    }

    @Test
    void testSignsWithStoredKey() throws Exception {
        ChannelAccount account = insert(1).get(0);
        when(repository.findById(account.getPublicKey())).thenReturn(Optional.of(account));

        Transaction signed = client.sign(mergeFrom(account.getPublicKey()), account.getPublicKey());

        assertThat(LedgerTransactions.isSignedBy(signed, account.getPublicKey())).isTrue();
    }

    @Test
    void testUnknownAccount() {
        when(repository.findById(anyString())).thenReturn(Optional.empty());
        Transaction transaction = mergeFrom(KeyPair.random().getAccountId());

        assertThatThrownBy(() -> client.sign(transaction, transaction.getSourceAccount()))
                .isInstanceOf(SignatureException.class);
    }

    @Test
    void testInvalidBatchSize() {
        assertThatThrownBy(() -> client.batchInsert(0)).isInstanceOf(SignatureException.class);
    }

    @Test
    void testDeleteRemovesRow() throws Exception {
        client.delete("GABC");

        verify(repository).deleteById("GABC");
    }
}
