package com.nosota.disbursement.signing;

import com.nosota.disbursement.api.model.DistributionAccountType;
import com.nosota.disbursement.error.SignatureException;
import com.nosota.disbursement.error.SignatureServiceConfigurationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.stellar.sdk.Network;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The three signer roles used by the submitter and the pool manager.
 *
 * <ul>
 *   <li>channel account signer: signs as transaction source</li>
 *   <li>host signer: funds channel account creation and receives merged balances</li>
 *   <li>distribution account signers: authorize payment operations, one per custody type</li>
 * </ul>
 *
 * <p>Callers stay unaware of the custody model: the distribution account type resolved for a tenant
 * selects the backend. The service is validated on construction, a misconfiguration stops startup.
 */
@Getter
@Slf4j
public class SignatureService {

    private final String networkPassphrase;
    private final String hostAccountId;
    private final SignatureClient channelAccountSigner;
    private final SignatureClient hostSigner;
    private final Map<DistributionAccountType, SignatureClient> distributionAccountSigners;

    public SignatureService(String networkPassphrase,
                            String hostAccountId,
                            SignatureClient channelAccountSigner,
                            SignatureClient hostSigner,
                            Map<DistributionAccountType, SignatureClient> distributionAccountSigners) {
        this.networkPassphrase = networkPassphrase;
        this.hostAccountId = hostAccountId;
        this.channelAccountSigner = channelAccountSigner;
        this.hostSigner = hostSigner;
        this.distributionAccountSigners = distributionAccountSigners == null || distributionAccountSigners.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(distributionAccountSigners));
        validate();
    }

    /**
     * @return Network every transaction built for these signers must be bound to
     */
    public Network getNetwork() {
        return new Network(networkPassphrase);
    }

    /**
     * Checks that every role is set and that all signers target the same network.
     *
     * @throws SignatureServiceConfigurationException on any violation
     */
    public void validate() {
        if (networkPassphrase == null || networkPassphrase.isBlank()) {
            throw new SignatureServiceConfigurationException("Network passphrase cannot be empty");
        }
        if (channelAccountSigner == null) {
            throw new SignatureServiceConfigurationException("Channel account signer cannot be null");
        }
        if (hostSigner == null) {
            throw new SignatureServiceConfigurationException("Host signer cannot be null");
        }
        if (hostAccountId == null || hostAccountId.isBlank()) {
            throw new SignatureServiceConfigurationException("Host account id cannot be empty");
        }
        if (distributionAccountSigners.isEmpty()) {
            throw new SignatureServiceConfigurationException("At least one distribution account signer is required");
        }

        requireSameNetwork("channel account signer", channelAccountSigner);
        requireSameNetwork("host signer", hostSigner);
        distributionAccountSigners.forEach((type, signer) -> {
            if (signer == null) {
                throw new SignatureServiceConfigurationException("Distribution account signer for " + type + " cannot be null");
            }
            requireSameNetwork("distribution account signer " + type, signer);
        });

        log.info("Signature service validated: network={}, distributionSigners={}",
                networkPassphrase, distributionAccountSigners.keySet());
    }

    /**
     * @param type Custody type of the distribution account
     * @return Backend that signs for accounts of that type
     * @throws SignatureException when no backend is configured for the type
     */
    public SignatureClient distributionAccountSigner(DistributionAccountType type) throws SignatureException {
        SignatureClient signer = distributionAccountSigners.get(type);
        if (signer == null) {
            throw new SignatureException("No distribution account signer configured for type " + type);
        }
        return signer;
    }

    private void requireSameNetwork(String role, SignatureClient signer) {
        if (!networkPassphrase.equals(signer.networkPassphrase())) {
            throw new SignatureServiceConfigurationException(String.format(
                    "Network passphrase of %s (%s) does not match the configured network (%s)",
                    role, signer.networkPassphrase(), networkPassphrase));
        }
    }
}
