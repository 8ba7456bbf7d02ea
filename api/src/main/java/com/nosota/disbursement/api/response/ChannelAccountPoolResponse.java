package com.nosota.disbursement.api.response;

import java.util.List;

/**
 * Response DTO for pool sizing operations (create, ensure, delete all).
 *
 * @param target    Requested pool size (null for create and delete all)
 * @param before    Accounts in the pool before the operation
 * @param after     Accounts in the pool after the operation
 * @param created   Public keys of accounts created and activated
 * @param deleted   Public keys of accounts removed
 * @param shortfall Accounts that could not be removed because they were leased
 */
public record ChannelAccountPoolResponse(
        Integer target,
        long before,
        long after,
        List<String> created,
        List<String> deleted,
        int shortfall
) {
}
