package com.nosota.disbursement.api.model;

/**
 * Payment status in the disbursement lifecycle.
 * Legal moves between values are enforced by the payment status state machine.
 */
public enum PaymentStatus {
    /**
     * DRAFT: Payment belongs to a disbursement that has not been started yet.
     * Not visible to the submitter.
     */
    DRAFT,

    /**
     * READY: Payment can be claimed by the submitter.
     * Reached when a disbursement is started, on operator retry of a FAILED payment,
     * or when a transient submission failure requeues a PENDING payment.
     */
    READY,

    /**
     * PENDING: Payment has been claimed and a ledger transaction is being built,
     * submitted or awaited.
     */
    PENDING,

    /**
     * SUCCESS: Ledger confirmed the transaction.
     * This is a final state.
     */
    SUCCESS,

    /**
     * FAILED: Ledger rejected the transaction permanently, or the attempt budget was exhausted.
     * Only an explicit retry moves it back to READY.
     */
    FAILED,

    /**
     * CANCELED: Canceled by an operator or automatically after the tenant's aging threshold.
     * This is a final state.
     */
    CANCELED
}
