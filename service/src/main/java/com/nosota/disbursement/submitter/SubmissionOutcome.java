package com.nosota.disbursement.submitter;

/**
 * What a worker did with a claimed payment.
 */
public enum SubmissionOutcome {
    /** Confirmed on the ledger, payment SUCCESS. */
    SUCCESS,
    /** Permanently rejected or out of attempts, payment FAILED. */
    FAILED,
    /** Returned to READY for a later round. */
    REQUEUED,
    /** Ledger outcome still unknown, payment left PENDING for the lease sweep. */
    UNRESOLVED,
    /** The payment changed under the worker (canceled), nothing was submitted or recorded. */
    ABORTED
}
