package com.nosota.disbursement.ledger;

import lombok.Getter;

import java.util.List;
import java.util.Set;

/**
 * Error returned by Horizon, or a failure to reach it.
 *
 * <p>Carries the HTTP status (0 when no response was received) and, for rejected transactions,
 * the transaction and operation result codes used to tell a permanent rejection from a
 * transient failure.
 */
@Getter
public class LedgerException extends Exception {

    public static final int NO_RESPONSE = 0;

    private static final Set<String> PERMANENT_TRANSACTION_CODES = Set.of(
            "tx_bad_auth",
            "tx_bad_auth_extra",
            "tx_insufficient_balance"
    );

    private static final Set<String> PERMANENT_OPERATION_CODES = Set.of(
            "op_bad_auth",
            "op_underfunded",
            "op_src_not_authorized",
            "op_no_destination",
            "op_no_trust",
            "op_line_full",
            "op_not_authorized",
            "op_no_issuer"
    );

    private final int statusCode;
    private final String resultCode;
    private final List<String> operationResultCodes;

    public LedgerException(String message, int statusCode, String resultCode, List<String> operationResultCodes) {
        super(message);
        this.statusCode = statusCode;
        this.resultCode = resultCode;
        this.operationResultCodes = operationResultCodes == null ? List.of() : List.copyOf(operationResultCodes);
    }

    public LedgerException(String message, int statusCode) {
        this(message, statusCode, null, List.of());
    }

    public LedgerException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.resultCode = null;
        this.operationResultCodes = List.of();
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_RESPONSE;
        this.resultCode = null;
        this.operationResultCodes = List.of();
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    public boolean isTimeout() {
        return statusCode == 504;
    }

    public boolean hasResultCodes() {
        return resultCode != null || !operationResultCodes.isEmpty();
    }

    /**
     * Whether the ledger rejected the transaction for a reason that resubmitting cannot fix
     * (bad signatures, insufficient balance, missing destination or trustline, ...).
     */
    public boolean isPermanentRejection() {
        if (!hasResultCodes()) {
            return false;
        }
        if (resultCode != null && PERMANENT_TRANSACTION_CODES.contains(resultCode)) {
            return true;
        }
        return operationResultCodes.stream().anyMatch(PERMANENT_OPERATION_CODES::contains);
    }

    /**
     * Timeouts, rate limiting, server errors, stale sequence numbers, fee surges and I/O failures.
     * A lookup that found nothing is neither transient nor permanent.
     */
    public boolean isTransient() {
        return !isNotFound() && !isPermanentRejection();
    }

    /**
     * Short classification recorded on the payment: the first permanent code, the transaction
     * result code, the HTTP status or {@code network_error}.
     */
    public String classification() {
        for (String code : operationResultCodes) {
            if (PERMANENT_OPERATION_CODES.contains(code)) {
                return code;
            }
        }
        if (resultCode != null) {
            return resultCode;
        }
        if (statusCode == NO_RESPONSE) {
            return "network_error";
        }
        return "http_" + statusCode;
    }
}
