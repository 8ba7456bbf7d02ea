package com.nosota.disbursement.service;

import com.nosota.disbursement.api.model.DistributionAccountStatus;
import com.nosota.disbursement.api.model.DistributionAccountType;
import com.nosota.disbursement.config.CacheConfig;
import com.nosota.disbursement.config.TssProperties;
import com.nosota.disbursement.dto.ResolvedDistributionAccount;
import com.nosota.disbursement.error.DistributionAccountNotFoundException;
import com.nosota.disbursement.error.TenantNotFoundException;
import com.nosota.disbursement.event.DistributionAccountChangedEvent;
import com.nosota.disbursement.model.DistributionAccount;
import com.nosota.disbursement.repository.DistributionAccountRepository;
import com.nosota.disbursement.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;
import org.stellar.sdk.KeyPair;

/**
 * Resolves the distribution account that funds a tenant's payments.
 *
 * <p>Resolutions are cached per tenant and evicted when {@link DistributionAccountChangedEvent} is
 * published. Missing tenants and tenants without an active account are typed errors: there is
 * no fallback to the host account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributionAccountResolver {

    private final TenantRepository tenantRepository;
    private final DistributionAccountRepository distributionAccountRepository;
    private final TssProperties tssProperties;

    /**
     * @param tenantId Tenant id
     * @return Active distribution account of the tenant
     * @throws TenantNotFoundException             when the tenant does not exist
     * @throws DistributionAccountNotFoundException when the tenant has no active distribution account
     */
    @Cacheable(value = CacheConfig.DISTRIBUTION_ACCOUNTS_CACHE, key = "#tenantId")
    public ResolvedDistributionAccount resolve(String tenantId)
            throws TenantNotFoundException, DistributionAccountNotFoundException {
        if (!tenantRepository.existsById(tenantId)) {
            throw new TenantNotFoundException("Tenant not found: " + tenantId);
        }

        DistributionAccount account = distributionAccountRepository
                .findByTenantIdAndStatus(tenantId, DistributionAccountStatus.ACTIVE)
                .orElseThrow(() -> new DistributionAccountNotFoundException(
                        "No active distribution account for tenant " + tenantId));

        log.debug("Resolved distribution account: tenantId={}, address={}, type={}",
                tenantId, account.getPublicKey(), account.getType());
        return new ResolvedDistributionAccount(tenantId, account.getPublicKey(), account.getType(), account.getStatus());
    }

    /**
     * Platform distribution account configured through {@code tss.distribution-account-secret}.
     *
     * @throws DistributionAccountNotFoundException when no platform distribution account is configured
     */
    public ResolvedDistributionAccount hostDistributionAccount() throws DistributionAccountNotFoundException {
        String secret = tssProperties.getDistributionAccountSecret();
        if (secret == null || secret.isBlank()) {
            throw new DistributionAccountNotFoundException("No host distribution account is configured");
        }
        return new ResolvedDistributionAccount(
                null,
                KeyPair.fromSecretSeed(secret).getAccountId(),
                DistributionAccountType.STELLAR_ENV,
                DistributionAccountStatus.ACTIVE);
    }

    @TransactionalEventListener(fallbackExecution = true)
    @CacheEvict(value = CacheConfig.DISTRIBUTION_ACCOUNTS_CACHE, key = "#event.tenantId()")
    public void onDistributionAccountChanged(DistributionAccountChangedEvent event) {
        log.info("Distribution account changed, evicting cached resolution: tenantId={}", event.tenantId());
    }
}
