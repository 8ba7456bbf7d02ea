package com.nosota.disbursement.dto;

import com.nosota.disbursement.api.model.DistributionAccountStatus;
import com.nosota.disbursement.api.model.DistributionAccountType;

/**
 * Distribution account that funds a tenant's payments, with the custody type that selects its signer.
 *
 * @param tenantId Tenant, null for the host distribution account
 * @param address  Ledger account id
 * @param type     Custody type
 * @param status   Account status
 */
public record ResolvedDistributionAccount(
        String tenantId,
        String address,
        DistributionAccountType type,
        DistributionAccountStatus status
) {

    public boolean isActive() {
        return status == DistributionAccountStatus.ACTIVE;
    }
}
