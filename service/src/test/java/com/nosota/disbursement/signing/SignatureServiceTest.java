package com.nosota.disbursement.signing;

import com.nosota.disbursement.api.model.DistributionAccountType;
import com.nosota.disbursement.error.SignatureException;
import com.nosota.disbursement.error.SignatureServiceConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SignatureServiceTest {

    private static final String NETWORK = "Test SDF Network ; September 2015";
    private static final String HOST = "GHOST";

    private static SignatureClient signer(String network) {
        SignatureClient signer = mock(SignatureClient.class);
        when(signer.networkPassphrase()).thenReturn(network);
        return signer;
    }

    @Test
    void testSelectsDistributionSignerByType() throws Exception {
        SignatureClient env = signer(NETWORK);
        SignatureClient vault = signer(NETWORK);

        SignatureService service = new SignatureService(NETWORK, HOST, signer(NETWORK), signer(NETWORK),
                Map.of(DistributionAccountType.STELLAR_ENV, env, DistributionAccountType.STELLAR_DB_VAULT, vault));

        assertThat(service.distributionAccountSigner(DistributionAccountType.STELLAR_ENV)).isSameAs(env);
        assertThat(service.distributionAccountSigner(DistributionAccountType.STELLAR_DB_VAULT)).isSameAs(vault);
        assertThatThrownBy(() -> service.distributionAccountSigner(DistributionAccountType.CUSTODIAL))
                .isInstanceOf(SignatureException.class);
    }

    @Test
    void testNetworkMismatchFailsValidation() {
        assertThatThrownBy(() -> new SignatureService(NETWORK, HOST, signer(NETWORK), signer(NETWORK),
                Map.of(DistributionAccountType.STELLAR_ENV, signer("Public Global Stellar Network ; September 2015"))))
                .isInstanceOf(SignatureServiceConfigurationException.class)
                .hasMessageContaining("STELLAR_ENV");

        assertThatThrownBy(() -> new SignatureService(NETWORK, HOST, signer("other"), signer(NETWORK),
                Map.of(DistributionAccountType.STELLAR_ENV, signer(NETWORK))))
                .isInstanceOf(SignatureServiceConfigurationException.class);
    }

    @Test
    void testMissingRolesFailValidation() {
        assertThatThrownBy(() -> new SignatureService(NETWORK, HOST, null, signer(NETWORK),
                Map.of(DistributionAccountType.STELLAR_ENV, signer(NETWORK))))
                .isInstanceOf(SignatureServiceConfigurationException.class);
        assertThatThrownBy(() -> new SignatureService(NETWORK, HOST, signer(NETWORK), signer(NETWORK), Map.of()))
                .isInstanceOf(SignatureServiceConfigurationException.class);
        assertThatThrownBy(() -> new SignatureService(NETWORK, "", signer(NETWORK), signer(NETWORK),
                Map.of(DistributionAccountType.STELLAR_ENV, signer(NETWORK))))
                .isInstanceOf(SignatureServiceConfigurationException.class);
    }
}
