package com.nosota.disbursement.config;

import com.nosota.disbursement.ledger.HorizonLedgerClient;
import com.nosota.disbursement.ledger.LedgerClient;
import com.nosota.disbursement.ledger.LedgerException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.stellar.sdk.Server;

import java.time.Duration;

/**
 * Horizon client and the retry policy used around ledger calls by the pool manager.
 */
@Configuration
@Slf4j
public class LedgerClientConfig {

    @Bean
    public LedgerClient ledgerClient(TssProperties tssProperties) {
        if (tssProperties.getHorizonUrl() == null || tssProperties.getHorizonUrl().isBlank()) {
            throw new IllegalStateException("tss.horizon-url must be configured");
        }
        Duration timeout = tssProperties.getLedgerRequestTimeout();
        log.info("Horizon configured: url={}, timeout={}", tssProperties.getHorizonUrl(), timeout);

        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(timeout)
                .build();
        // a submission must not be replayed on a new connection
        OkHttpClient submitHttpClient = httpClient.newBuilder()
                .retryOnConnectionFailure(false)
                .build();
        return new HorizonLedgerClient(new Server(tssProperties.getHorizonUrl(), httpClient, submitHttpClient));
    }

    /**
     * Exponential backoff over {@link LedgerException}. Callers mark non transient errors as
     * exhausted so only transient failures are retried.
     */
    @Bean
    public RetryTemplate ledgerRetryTemplate(TssProperties tssProperties) {
        TssProperties.ChannelAccounts channelAccounts = tssProperties.getChannelAccounts();
        return RetryTemplate.builder()
                .maxAttempts(channelAccounts.getLedgerRetryMaxAttempts())
                .exponentialBackoff(
                        channelAccounts.getLedgerRetryInitialBackoff().toMillis(),
                        2.0,
                        channelAccounts.getLedgerRetryMaxBackoff().toMillis())
                .retryOn(LedgerException.class)
                .build();
    }
}
