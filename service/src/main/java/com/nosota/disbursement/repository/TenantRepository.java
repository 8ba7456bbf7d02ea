package com.nosota.disbursement.repository;

import com.nosota.disbursement.model.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TenantRepository extends JpaRepository<Tenant, String> {

    /**
     * Tenants with automatic cancellation of stale READY payments enabled.
     */
    List<Tenant> findByPaymentCancellationPeriodDaysIsNotNull();
}
