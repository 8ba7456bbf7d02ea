package com.nosota.disbursement.controller;

import com.nosota.disbursement.api.ChannelAccountApi;
import com.nosota.disbursement.api.dto.ChannelAccountDTO;
import com.nosota.disbursement.api.request.CreateChannelAccountsRequest;
import com.nosota.disbursement.api.request.EnsureChannelAccountsRequest;
import com.nosota.disbursement.api.response.ChannelAccountPoolResponse;
import com.nosota.disbursement.api.response.ChannelAccountVerificationResponse;
import com.nosota.disbursement.service.ChannelAccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for channel account pool administration.
 *
 * <p>Implements {@link ChannelAccountApi}. Conflicts (leased accounts) surface as 409 with the partial
 * result of the operation in the error details.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ChannelAccountController implements ChannelAccountApi {

    private final ChannelAccountService channelAccountService;

    @Override
    public ResponseEntity<List<ChannelAccountDTO>> viewChannelAccounts() {
        return ResponseEntity.ok(channelAccountService.viewChannelAccounts());
    }

    @Override
    public ResponseEntity<ChannelAccountPoolResponse> createChannelAccounts(CreateChannelAccountsRequest request) throws Exception {
        ChannelAccountPoolResponse response = channelAccountService.createChannelAccounts(request.count());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<ChannelAccountPoolResponse> ensureChannelAccountsCount(EnsureChannelAccountsRequest request) throws Exception {
        return ResponseEntity.ok(channelAccountService.ensureChannelAccountsCount(request.count()));
    }

    @Override
    public ResponseEntity<Void> deleteChannelAccount(String publicKey) throws Exception {
        channelAccountService.deleteChannelAccount(publicKey);
        return ResponseEntity.noContent().build();
    }

    @Override
    public ResponseEntity<ChannelAccountPoolResponse> deleteAllChannelAccounts() throws Exception {
        return ResponseEntity.ok(channelAccountService.deleteAllChannelAccounts());
    }

    @Override
    public ResponseEntity<ChannelAccountVerificationResponse> verifyChannelAccounts(boolean pruneInvalid) throws Exception {
        return ResponseEntity.ok(channelAccountService.verifyChannelAccounts(pruneInvalid));
    }
}
