package com.nosota.disbursement.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Tenant registry entry. Provisioned by the tenant management service.
 */
@Entity
@Table(name = "tenants")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Tenant {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    /**
     * Days after which a payment left in READY is canceled automatically.
     * Null disables automatic cancellation for the tenant.
     */
    @Column(name = "payment_cancellation_period_days")
    private Integer paymentCancellationPeriodDays;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
