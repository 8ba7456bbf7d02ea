package com.nosota.disbursement.service;

import com.nosota.disbursement.api.model.DistributionAccountStatus;
import com.nosota.disbursement.api.model.DistributionAccountType;
import com.nosota.disbursement.error.DistributionAccountNotFoundException;
import com.nosota.disbursement.error.SignatureException;
import com.nosota.disbursement.error.TenantNotFoundException;
import com.nosota.disbursement.error.UnsupportedSignatureOperationException;
import com.nosota.disbursement.event.DistributionAccountChangedEvent;
import com.nosota.disbursement.model.DistributionAccount;
import com.nosota.disbursement.repository.DistributionAccountRepository;
import com.nosota.disbursement.repository.TenantRepository;
import com.nosota.disbursement.signing.SignatureService;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Registers and activates tenant distribution accounts.
 *
 * <p>Every change publishes {@link DistributionAccountChangedEvent} so cached resolutions are dropped
 * once the change is committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributionAccountService {

    private final TenantRepository tenantRepository;
    private final DistributionAccountRepository distributionAccountRepository;
    private final SignatureService signatureService;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Registers an existing ledger account for a tenant, PENDING_FUNDING until activated.
     */
    @Transactional
    public UUID register(String tenantId, String publicKey, DistributionAccountType type) throws TenantNotFoundException {
        if (!tenantRepository.existsById(tenantId)) {
            throw new TenantNotFoundException("Tenant not found: " + tenantId);
        }

        LocalDateTime now = LocalDateTime.now();
        DistributionAccount account = new DistributionAccount();
        account.setTenantId(tenantId);
        account.setPublicKey(publicKey);
        account.setType(type);
        account.setStatus(DistributionAccountStatus.PENDING_FUNDING);
        account.setCreatedAt(now);
        account.setUpdatedAt(now);
        DistributionAccount saved = distributionAccountRepository.save(account);

        log.info("Registered distribution account: tenantId={}, publicKey={}, type={}", tenantId, publicKey, type);
        eventPublisher.publishEvent(new DistributionAccountChangedEvent(tenantId));
        return saved.getId();
    }

    /**
     * Generates a self-custodied key in the database vault and registers it for the tenant.
     * The account still has to be funded on the ledger before it is activated.
     */
    @Transactional
    public UUID provisionVaultAccount(String tenantId)
            throws TenantNotFoundException, SignatureException, UnsupportedSignatureOperationException {
        String publicKey = signatureService.distributionAccountSigner(DistributionAccountType.STELLAR_DB_VAULT)
                .batchInsert(1)
                .get(0);
        return register(tenantId, publicKey, DistributionAccountType.STELLAR_DB_VAULT);
    }

    /**
     * Makes the account the tenant's active distribution account. The previously active account,
     * if any, is disabled.
     */
    @Transactional
    public void activate(UUID distributionAccountId) throws DistributionAccountNotFoundException {
        DistributionAccount account = distributionAccountRepository.findById(distributionAccountId)
                .orElseThrow(() -> new DistributionAccountNotFoundException(
                        "Distribution account not found: " + distributionAccountId));

        LocalDateTime now = LocalDateTime.now();
        distributionAccountRepository.findByTenantIdAndStatus(account.getTenantId(), DistributionAccountStatus.ACTIVE)
                .filter(current -> !current.getId().equals(account.getId()))
                .ifPresent(current -> {
                    current.setStatus(DistributionAccountStatus.DISABLED);
                    current.setUpdatedAt(now);
                    // flush before activating, the partial unique index allows one ACTIVE row per tenant
                    distributionAccountRepository.saveAndFlush(current);
                    log.info("Disabled distribution account: tenantId={}, publicKey={}",
                            current.getTenantId(), current.getPublicKey());
                });

        account.setStatus(DistributionAccountStatus.ACTIVE);
        account.setUpdatedAt(now);
        distributionAccountRepository.save(account);

        log.info("Activated distribution account: tenantId={}, publicKey={}, type={}",
                account.getTenantId(), account.getPublicKey(), account.getType());
        eventPublisher.publishEvent(new DistributionAccountChangedEvent(account.getTenantId()));
    }

    /**
     * Disables a distribution account. Payments of its tenant stop resolving until another one is activated.
     */
    @Transactional
    public void disable(UUID distributionAccountId) throws DistributionAccountNotFoundException {
        DistributionAccount account = distributionAccountRepository.findById(distributionAccountId)
                .orElseThrow(() -> new DistributionAccountNotFoundException(
                        "Distribution account not found: " + distributionAccountId));
        account.setStatus(DistributionAccountStatus.DISABLED);
        account.setUpdatedAt(LocalDateTime.now());
        distributionAccountRepository.save(account);

        log.info("Disabled distribution account: tenantId={}, publicKey={}", account.getTenantId(), account.getPublicKey());
        eventPublisher.publishEvent(new DistributionAccountChangedEvent(account.getTenantId()));
    }
}
