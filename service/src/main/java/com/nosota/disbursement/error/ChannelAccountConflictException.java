package com.nosota.disbursement.error;

import com.nosota.disbursement.api.response.ChannelAccountPoolResponse;
import lombok.Getter;

/**
 * Thrown when a pool operation would touch a leased channel account.
 *
 * <p>Raised for a delete of a leased account, and for pool reductions that could not reach
 * their target because the remaining accounts are leased. In the latter case the operation
 * has already completed as far as it safely could and {@link #getPartialResult()} describes it.
 */
@Getter
public class ChannelAccountConflictException extends Exception {

    private final ChannelAccountPoolResponse partialResult;

    public ChannelAccountConflictException(String message) {
        super(message);
        this.partialResult = null;
    }

    public ChannelAccountConflictException(String message, ChannelAccountPoolResponse partialResult) {
        super(message);
        this.partialResult = partialResult;
    }
}
