package com.nosota.disbursement.api.model;

/**
 * Lease state of a channel account.
 */
public enum ChannelAccountState {
    /**
     * FREE: Available to be leased by a submitter worker.
     */
    FREE,

    /**
     * LEASED: Referenced by exactly one in-flight transaction (or by its own activation transaction
     * while being created). Cannot be leased again or deleted until released.
     */
    LEASED,

    /**
     * PENDING_DELETION: Being merged back into the host account and removed from the pool.
     */
    PENDING_DELETION
}
