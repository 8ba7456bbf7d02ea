package com.nosota.disbursement.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for creating channel accounts.
 *
 * @param count Number of accounts to create and activate on the ledger
 */
public record CreateChannelAccountsRequest(
        @NotNull(message = "Count is required")
        @Min(value = 1, message = "Count must be at least 1")
        @Max(value = 1000, message = "Count must not exceed 1000")
        Integer count
) {
}
