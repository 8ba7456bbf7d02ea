package com.nosota.disbursement.api.response;

import java.util.List;

/**
 * Response DTO for a verification run of stored channel accounts against the ledger.
 *
 * @param checked Number of accounts checked
 * @param invalid Accounts stored locally but missing on the ledger
 * @param pruned  Invalid accounts removed from storage (empty when pruning was not requested)
 * @param skipped Invalid accounts left in place because they were leased
 */
public record ChannelAccountVerificationResponse(
        int checked,
        List<String> invalid,
        List<String> pruned,
        List<String> skipped
) {
}
