package com.nosota.disbursement.event;

/**
 * Published after a tenant's distribution account is registered, activated or disabled.
 *
 * @param tenantId Tenant whose resolution must be refreshed
 */
public record DistributionAccountChangedEvent(String tenantId) {
}
