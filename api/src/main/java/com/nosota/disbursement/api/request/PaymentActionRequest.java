package com.nosota.disbursement.api.request;

import jakarta.validation.constraints.Size;

/**
 * Optional operator note attached to an administrative payment action.
 *
 * @param message Note recorded in the payment status history (max 500 characters)
 */
public record PaymentActionRequest(
        @Size(max = 500, message = "Message must not exceed 500 characters")
        String message
) {
}
