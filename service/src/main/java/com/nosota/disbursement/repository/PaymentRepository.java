package com.nosota.disbursement.repository;

import com.nosota.disbursement.api.model.PaymentStatus;
import com.nosota.disbursement.model.Payment;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    /**
     * Loads a payment and locks its row until the end of the transaction.
     *
     * @param id Payment id
     * @return Optional containing the locked payment
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.id = :id")
    Optional<Payment> getOneForUpdate(@Param("id") UUID id);

    /**
     * Selects READY payments of one type, oldest update first, locking the rows and
     * skipping rows already locked by a concurrent claimer.
     *
     * @param type  Payment type name (DISBURSEMENT or DIRECT)
     * @param limit Maximum number of rows
     * @return Locked READY payments
     */
    @Query(value = """
            SELECT * FROM payments
            WHERE status = 'READY' AND type = :type
            ORDER BY updated_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<Payment> findReadyForUpdateSkipLocked(@Param("type") String type, @Param("limit") int limit);

    /**
     * Finds PENDING payments not touched since the given time.
     * Candidates for the lease sweep after an ungraceful shutdown.
     */
    @Query("SELECT p FROM Payment p WHERE p.status = :status AND p.updatedAt < :before ORDER BY p.updatedAt ASC")
    List<Payment> findByStatusUpdatedBefore(@Param("status") PaymentStatus status,
                                            @Param("before") LocalDateTime before);

    /**
     * Finds a tenant's READY payments whose latest READY history entry is older than the threshold.
     */
    @Query(value = """
            SELECT p.* FROM payments p
            WHERE p.status = 'READY'
              AND p.tenant_id = :tenantId
              AND (
                  SELECT MAX((h ->> 'timestamp')::timestamp)
                  FROM jsonb_array_elements(p.status_history) AS h
                  WHERE h ->> 'status' = 'READY'
              ) <= :threshold
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<Payment> findReadyToCancel(@Param("tenantId") String tenantId,
                                    @Param("threshold") LocalDateTime threshold);

    long countByStatus(PaymentStatus status);
}
