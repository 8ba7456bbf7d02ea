package com.nosota.disbursement.signing;

import com.nosota.disbursement.error.SignatureException;
import com.nosota.disbursement.error.SignatureServiceConfigurationException;
import com.nosota.disbursement.error.UnsupportedSignatureOperationException;
import com.nosota.disbursement.ledger.LedgerTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.stellar.sdk.KeyPair;
import org.stellar.sdk.Transaction;

import java.time.Duration;
import java.util.Base64;
import java.util.List;

/**
 * Delegates signing to a third-party custodian that holds the distribution account key.
 *
 * <p>Request: {@code POST /v1/signatures} with the account, network passphrase, transaction hash
 * and the envelope XDR (Base64). Response: {@code {"publicKey", "signature"}} with a Base64 signature,
 * which is verified against the account before it is attached.
 */
@Slf4j
public class CustodialSignatureClient implements SignatureClient {

    private final String networkPassphrase;
    private final WebClient webClient;
    private final Duration requestTimeout;

    public CustodialSignatureClient(String networkPassphrase, WebClient webClient, Duration requestTimeout) {
        if (networkPassphrase == null || networkPassphrase.isBlank()) {
            throw new SignatureServiceConfigurationException("Network passphrase cannot be empty for " + type());
        }
        this.networkPassphrase = networkPassphrase;
        this.webClient = webClient;
        this.requestTimeout = requestTimeout;
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
            throw new SignatureException("Transaction network passphrase does not match " + type());
        }

        for (String account : accounts) {
            if (LedgerTransactions.isSignedBy(transaction, account)) {
                continue;
            }
            SignatureBody response = requestSignature(account, transaction);
            byte[] signature;
            try {
                signature = Base64.getDecoder().decode(response.signature());
            } catch (IllegalArgumentException e) {
                throw new SignatureException("Custodian returned a malformed signature for account " + account, e);
            }
            if (!account.equals(response.publicKey())
                    || !KeyPair.fromAccountId(account).verify(transaction.hash(), signature)) {
                throw new SignatureException("Custodian signature does not verify for account " + account);
            }
            transaction.addSignature(LedgerTransactions.decorated(account, signature));
        }
        return transaction;
    }

    private SignatureBody requestSignature(String account, Transaction transaction) throws SignatureException {
        SignatureRequest request = new SignatureRequest(account, networkPassphrase, transaction.hashHex(),
                transaction.toEnvelopeXdrBase64());
        SignatureBody response;
        try {
            response = webClient.post()
                    .uri("/v1/signatures")
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(SignatureBody.class)
                    .block(requestTimeout);
        } catch (WebClientException | IllegalStateException e) {
            throw new SignatureException("Custodian signing request failed for account " + account, e);
        }
        if (response == null || response.signature() == null) {
            throw new SignatureException("Custodian returned no signature for account " + account);
        }
        log.debug("Custodian signed transaction: account={}, hash={}", account, transaction.hashHex());
        return response;
    }

    @Override
    public List<String> batchInsert(int number) throws UnsupportedSignatureOperationException {
        throw new UnsupportedSignatureOperationException("Keys are held by the custodian, batch insert is not applicable");
    }

    @Override
    public void delete(String publicKey) throws UnsupportedSignatureOperationException {
        throw new UnsupportedSignatureOperationException("Keys are held by the custodian, delete is not applicable");
    }

    @Override
    public SignatureClientType type() {
        return SignatureClientType.DISTRIBUTION_ACCOUNT_CUSTODIAL;
    }

    record SignatureRequest(String accountId, String networkPassphrase, String transactionHash,
                            String envelopeXdr) {
    }

    record SignatureBody(String publicKey, String signature) {
    }
}
