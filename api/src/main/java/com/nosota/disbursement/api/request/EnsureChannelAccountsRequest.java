package com.nosota.disbursement.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for resizing the channel account pool.
 *
 * @param count Target number of usable channel accounts
 */
public record EnsureChannelAccountsRequest(
        @NotNull(message = "Count is required")
        @Min(value = 1, message = "Count must be at least 1")
        @Max(value = 1000, message = "Count must not exceed 1000")
        Integer count
) {
}
