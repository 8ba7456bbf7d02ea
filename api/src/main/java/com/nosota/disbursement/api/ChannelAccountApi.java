package com.nosota.disbursement.api;

import com.nosota.disbursement.api.dto.ChannelAccountDTO;
import com.nosota.disbursement.api.request.CreateChannelAccountsRequest;
import com.nosota.disbursement.api.request.EnsureChannelAccountsRequest;
import com.nosota.disbursement.api.response.ChannelAccountPoolResponse;
import com.nosota.disbursement.api.response.ChannelAccountVerificationResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Channel account pool administration API.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Listing the pool</li>
 *   <li>Creating accounts and resizing the pool</li>
 *   <li>Deleting single accounts or the whole pool</li>
 *   <li>Verifying stored accounts against the ledger</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>ChannelAccountController - in service module (server-side implementation)</li>
 *   <li>ChannelAccountClient - in api module (WebClient-based client for operator tooling)</li>
 * </ul>
 */
@RequestMapping("/api/v1/channel-accounts")
public interface ChannelAccountApi {

    /**
     * Lists all channel accounts currently stored.
     *
     * @return Channel accounts, oldest first
     */
    @GetMapping
    ResponseEntity<List<ChannelAccountDTO>> viewChannelAccounts();

    /**
     * Creates and activates new channel accounts.
     *
     * @param request Number of accounts to create
     * @return Pool sizing result with the created public keys
     */
    @PostMapping
    ResponseEntity<ChannelAccountPoolResponse> createChannelAccounts(
            @Valid @RequestBody CreateChannelAccountsRequest request) throws Exception;

    /**
     * Resizes the pool to the requested number of accounts.
     * Leased accounts are never removed; a shortfall is reported as a conflict.
     *
     * @param request Target pool size
     * @return Pool sizing result
     */
    @PutMapping("/count")
    ResponseEntity<ChannelAccountPoolResponse> ensureChannelAccountsCount(
            @Valid @RequestBody EnsureChannelAccountsRequest request) throws Exception;

    /**
     * Deletes a single channel account, merging its balance back into the host account.
     *
     * @param publicKey Channel account id
     * @return 204 when deleted
     */
    @DeleteMapping("/{publicKey}")
    ResponseEntity<Void> deleteChannelAccount(
            @PathVariable("publicKey") String publicKey) throws Exception;

    /**
     * Deletes every free channel account.
     *
     * @return Pool sizing result
     */
    @DeleteMapping
    ResponseEntity<ChannelAccountPoolResponse> deleteAllChannelAccounts() throws Exception;

    /**
     * Cross-checks stored accounts against the ledger.
     *
     * @param pruneInvalid Remove accounts that do not exist on the ledger
     * @return Verification report
     */
    @PostMapping("/verify")
    ResponseEntity<ChannelAccountVerificationResponse> verifyChannelAccounts(
            @RequestParam(value = "pruneInvalid", defaultValue = "false") boolean pruneInvalid) throws Exception;
}
