package com.nosota.disbursement.repository;

import com.nosota.disbursement.api.model.DistributionAccountStatus;
import com.nosota.disbursement.model.DistributionAccount;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DistributionAccountRepository extends JpaRepository<DistributionAccount, UUID> {

    /**
     * Finds the tenant's distribution account in the given status.
     * For ACTIVE there is at most one row per tenant.
     */
    Optional<DistributionAccount> findByTenantIdAndStatus(String tenantId, DistributionAccountStatus status);

    Optional<DistributionAccount> findFirstByPublicKey(String publicKey);

    List<DistributionAccount> findByTenantId(String tenantId);
}
