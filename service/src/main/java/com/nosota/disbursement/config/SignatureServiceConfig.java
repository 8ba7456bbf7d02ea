package com.nosota.disbursement.config;

import com.nosota.disbursement.api.model.DistributionAccountType;
import com.nosota.disbursement.crypto.PrivateKeyEncrypter;
import com.nosota.disbursement.repository.ChannelAccountRepository;
import com.nosota.disbursement.repository.DistributionAccountVaultRepository;
import com.nosota.disbursement.signing.AccountEnvSignatureClient;
import com.nosota.disbursement.signing.ChannelAccountDbSignatureClient;
import com.nosota.disbursement.signing.CustodialSignatureClient;
import com.nosota.disbursement.signing.DistributionAccountDbVaultSignatureClient;
import com.nosota.disbursement.signing.SignatureClient;
import com.nosota.disbursement.signing.SignatureClientType;
import com.nosota.disbursement.signing.SignatureService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the signer roles from {@link TssProperties}.
 *
 * <p>Distribution account backends:
 * <ul>
 *   <li>STELLAR_ENV: only when {@code tss.distribution-account-secret} is set</li>
 *   <li>STELLAR_DB_VAULT: always</li>
 *   <li>CUSTODIAL: only when {@code tss.custodian.base-url} is set</li>
 * </ul>
 * Any misconfiguration fails {@link SignatureService} construction and with it the application start.
 */
@Configuration
@Slf4j
public class SignatureServiceConfig {

    @Bean
    public SignatureService signatureService(TssProperties tssProperties,
                                             PrivateKeyEncrypter privateKeyEncrypter,
                                             ChannelAccountRepository channelAccountRepository,
                                             DistributionAccountVaultRepository distributionAccountVaultRepository,
                                             WebClient.Builder webClientBuilder) {
        String networkPassphrase = tssProperties.getNetworkPassphrase();

        AccountEnvSignatureClient hostSigner = new AccountEnvSignatureClient(
                networkPassphrase, tssProperties.getHostAccountSecret(), SignatureClientType.HOST_ENV);

        SignatureClient channelAccountSigner = new ChannelAccountDbSignatureClient(
                networkPassphrase,
                tssProperties.getChannelAccountEncryptionPassphrase(),
                privateKeyEncrypter,
                channelAccountRepository);

        Map<DistributionAccountType, SignatureClient> distributionSigners = new EnumMap<>(DistributionAccountType.class);

        if (hasText(tssProperties.getDistributionAccountSecret())) {
            distributionSigners.put(DistributionAccountType.STELLAR_ENV, new AccountEnvSignatureClient(
                    networkPassphrase,
                    tssProperties.getDistributionAccountSecret(),
                    SignatureClientType.DISTRIBUTION_ACCOUNT_ENV));
        }

        String vaultPassphrase = hasText(tssProperties.getDistributionAccountEncryptionPassphrase())
                ? tssProperties.getDistributionAccountEncryptionPassphrase()
                : tssProperties.getChannelAccountEncryptionPassphrase();
        distributionSigners.put(DistributionAccountType.STELLAR_DB_VAULT, new DistributionAccountDbVaultSignatureClient(
                networkPassphrase, vaultPassphrase, privateKeyEncrypter, distributionAccountVaultRepository));

        TssProperties.Custodian custodian = tssProperties.getCustodian();
        if (hasText(custodian.getBaseUrl())) {
            WebClient.Builder custodianClient = webClientBuilder.clone().baseUrl(custodian.getBaseUrl());
            if (hasText(custodian.getApiKey())) {
                custodianClient.defaultHeader("X-API-Key", custodian.getApiKey());
            }
            distributionSigners.put(DistributionAccountType.CUSTODIAL, new CustodialSignatureClient(
                    networkPassphrase, custodianClient.build(), custodian.getRequestTimeout()));
        }

        log.info("Configuring signature service: host={}, distributionBackends={}",
                hostSigner.getAccountId(), distributionSigners.keySet());

        return new SignatureService(
                networkPassphrase,
                hostSigner.getAccountId(),
                channelAccountSigner,
                hostSigner,
                distributionSigners);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
