package com.nosota.disbursement.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "tss")
@Data
public class TssProperties {

    /**
     * Passphrase of the ledger network every signer must be configured for.
     */
    private String networkPassphrase = "Test SDF Network ; September 2015";

    /**
     * Base URL of the Horizon server.
     * Example: https://horizon-testnet.stellar.org
     */
    private String horizonUrl;

    /**
     * Timeout of a single Horizon call. Submission waits for inclusion, so keep it
     * above the ledger close time.
     */
    private Duration ledgerRequestTimeout = Duration.ofSeconds(30);

    /**
     * Maximum fee per operation, in stroops.
     */
    private long maxBaseFee = 10_000;

    /**
     * Validity window of a built transaction (upper time bound = now + timeout).
     */
    private Duration transactionTimeout = Duration.ofSeconds(300);

    /**
     * Secret seed of the host account that funds channel account creation.
     */
    private String hostAccountSecret;

    /**
     * Secret seed of the platform distribution account (STELLAR_ENV backend).
     */
    private String distributionAccountSecret;

    /**
     * Passphrase protecting channel account keys at rest.
     */
    private String channelAccountEncryptionPassphrase;

    /**
     * Passphrase protecting vaulted distribution account keys at rest.
     * Falls back to the channel account passphrase when empty.
     */
    private String distributionAccountEncryptionPassphrase;

    private ChannelAccounts channelAccounts = new ChannelAccounts();

    private Submitter submitter = new Submitter();

    private Custodian custodian = new Custodian();

    @Data
    public static class ChannelAccounts {
        /**
         * Native balance each new channel account is created with.
         */
        private BigDecimal startingBalance = new BigDecimal("2");

        /**
         * Attempts of a ledger call during create/delete before the error is surfaced.
         */
        private int ledgerRetryMaxAttempts = 4;

        /**
         * Initial retry backoff, doubled on every attempt up to the maximum.
         */
        private Duration ledgerRetryInitialBackoff = Duration.ofMillis(500);

        private Duration ledgerRetryMaxBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class Submitter {
        /**
         * Starts the submission loop with the application context.
         */
        private boolean enabled = true;

        /**
         * Pause between two claim rounds when the previous round found no work.
         */
        private Duration pollingInterval = Duration.ofSeconds(1);

        /**
         * Maximum payments claimed per round.
         */
        private int batchSize = 20;

        /**
         * Concurrent submission workers.
         */
        private int workers = 8;

        /**
         * Submission attempts before a transient failure turns the payment FAILED.
         */
        private int maxAttempts = 5;

        /**
         * How long a worker keeps looking for the ledger outcome of a submission whose response was
         * indeterminate (timeout, gateway error) before leaving it to the lease sweep.
         */
        private Duration submissionTimeout = Duration.ofSeconds(60);

        /**
         * Pause between two ledger lookups while the outcome of a submission is unknown.
         */
        private Duration confirmationPollInterval = Duration.ofSeconds(2);

        /**
         * Leases older than this are considered abandoned by the lease sweep.
         */
        private Duration leaseTimeout = Duration.ofMinutes(5);

        /**
         * How long a claimed payment waits for a free channel account before going back to READY.
         */
        private Duration leaseWaitTimeout = Duration.ofSeconds(10);

        /**
         * Share of every claim round reserved for DIRECT payments (0..1). Unused share is filled
         * with the other type.
         */
        private double directPaymentShare = 0.25;

        /**
         * Transient ledger responses tolerated before the claim size is reduced.
         */
        private int indeterminateResponsesTolerance = 10;

        /**
         * Claim size used while the ledger is returning indeterminate responses.
         */
        private int downsizedBatchSize = 8;

        /**
         * How long the reduced claim size stays in effect.
         */
        private Duration downsizeWindow = Duration.ofMinutes(3);

        /**
         * Time the loop waits for in-flight workers on shutdown.
         */
        private Duration shutdownGracePeriod = Duration.ofSeconds(90);
    }

    @Data
    public static class Custodian {
        /**
         * Base URL of the custodian signing API.
         */
        private String baseUrl;

        private String apiKey;

        private Duration requestTimeout = Duration.ofSeconds(30);
    }
}
