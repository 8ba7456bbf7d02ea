package com.nosota.disbursement.repository;

import com.nosota.disbursement.api.model.ChannelAccountState;
import com.nosota.disbursement.model.ChannelAccount;
import jakarta.transaction.Transactional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Channel account storage.
 *
 * <p>Lease state changes are conditional UPDATE statements: a lease only succeeds on a FREE row
 * and a release only touches a LEASED row, so concurrent processes never hold the same account.
 */
public interface ChannelAccountRepository extends JpaRepository<ChannelAccount, String> {

    List<ChannelAccount> findAllByOrderByCreatedAtAsc();

    List<ChannelAccount> findByState(ChannelAccountState state);

    long countByState(ChannelAccountState state);

    /**
     * Counts accounts that belong to the usable pool (FREE or LEASED).
     */
    @Query("SELECT COUNT(c) FROM ChannelAccount c WHERE c.state <> :excluded")
    long countByStateNot(@Param("excluded") ChannelAccountState excluded);

    /**
     * Selects leasable accounts and locks their rows, skipping rows locked by another claimer.
     * An account is leasable when FREE, or LEASED with a lock that ended before {@code currentLedger}:
     * the transaction it was leased for can no longer be included. Must run inside a transaction.
     *
     * @param currentLedger Latest ledger number
     * @param limit         Maximum number of rows
     * @return Leasable accounts, least recently used first
     */
    @Query(value = """
            SELECT * FROM channel_accounts
            WHERE state = 'FREE'
               OR (state = 'LEASED' AND locked_until_ledger_number < :currentLedger)
            ORDER BY updated_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<ChannelAccount> findLeasableForUpdateSkipLocked(@Param("currentLedger") long currentLedger,
                                                         @Param("limit") int limit);

    /**
     * Free accounts, oldest first. Candidates when the pool is shrunk.
     */
    @Query(value = """
            SELECT * FROM channel_accounts
            WHERE state = 'FREE'
            ORDER BY created_at ASC
            LIMIT :limit
            """, nativeQuery = true)
    List<ChannelAccount> findOldestFree(@Param("limit") int limit);

    /**
     * Leases a FREE account, or takes over a lease whose ledger lock ended before {@code currentLedger}.
     *
     * @return 1 if the lease was taken, 0 if the account was not leasable
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ChannelAccount c
            SET c.state = :leased,
                c.leasedAt = :now,
                c.lockedUntilLedgerNumber = :lockedUntil,
                c.leasedByPaymentId = :paymentId,
                c.updatedAt = :now
            WHERE c.publicKey = :publicKey
              AND (c.state = :free OR (c.state = :leased AND c.lockedUntilLedgerNumber < :currentLedger))
            """)
    int lease(@Param("publicKey") String publicKey,
              @Param("currentLedger") long currentLedger,
              @Param("lockedUntil") Long lockedUntilLedgerNumber,
              @Param("paymentId") UUID paymentId,
              @Param("now") LocalDateTime now,
              @Param("leased") ChannelAccountState leased,
              @Param("free") ChannelAccountState free);

    /**
     * Releases a LEASED account back to FREE.
     *
     * @return 1 if released, 0 if the account was not leased (already released or deleted)
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ChannelAccount c
            SET c.state = :free,
                c.leasedAt = NULL,
                c.lockedUntilLedgerNumber = NULL,
                c.leasedByPaymentId = NULL,
                c.updatedAt = :now
            WHERE c.publicKey = :publicKey AND c.state = :leased
            """)
    int release(@Param("publicKey") String publicKey,
                @Param("now") LocalDateTime now,
                @Param("leased") ChannelAccountState leased,
                @Param("free") ChannelAccountState free);

    /**
     * Releases an account only while it is still leased for {@code paymentId}.
     *
     * @return 1 if released, 0 if the lease ended or was taken over by another payment
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ChannelAccount c
            SET c.state = :free,
                c.leasedAt = NULL,
                c.lockedUntilLedgerNumber = NULL,
                c.leasedByPaymentId = NULL,
                c.updatedAt = :now
            WHERE c.publicKey = :publicKey AND c.state = :leased AND c.leasedByPaymentId = :paymentId
            """)
    int releaseLease(@Param("publicKey") String publicKey,
                     @Param("paymentId") UUID paymentId,
                     @Param("now") LocalDateTime now,
                     @Param("leased") ChannelAccountState leased,
                     @Param("free") ChannelAccountState free);

    /**
     * Moves an account between two states if it is currently in {@code from}.
     *
     * @return 1 if moved, 0 otherwise
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ChannelAccount c
            SET c.state = :to, c.updatedAt = :now
            WHERE c.publicKey = :publicKey AND c.state = :from
            """)
    int compareAndSetState(@Param("publicKey") String publicKey,
                           @Param("from") ChannelAccountState from,
                           @Param("to") ChannelAccountState to,
                           @Param("now") LocalDateTime now);

    /**
     * Removes an account row, only if it is in the given state.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ChannelAccount c WHERE c.publicKey = :publicKey AND c.state = :state")
    int deleteByPublicKeyAndState(@Param("publicKey") String publicKey,
                                  @Param("state") ChannelAccountState state);

    /**
     * Accounts whose lease or deletion started before the given time.
     */
    @Query("SELECT c FROM ChannelAccount c WHERE c.state = :state AND c.updatedAt < :before")
    List<ChannelAccount> findStale(@Param("state") ChannelAccountState state,
                                   @Param("before") LocalDateTime before);
}
