package com.nosota.disbursement.api.model;

/**
 * Origin of a payment.
 */
public enum PaymentType {
    /**
     * Payment created as part of a bulk disbursement.
     */
    DISBURSEMENT,

    /**
     * Payment issued directly to a single receiver, outside of a disbursement.
     */
    DIRECT
}
