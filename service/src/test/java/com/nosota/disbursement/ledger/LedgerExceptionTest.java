package com.nosota.disbursement.ledger;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerExceptionTest {

    @Test
    void testPermanentOperationCode() {
        LedgerException e = new LedgerException("failed", 400, "tx_failed", List.of("op_success", "op_no_trust"));

        assertThat(e.isPermanentRejection()).isTrue();
        assertThat(e.isTransient()).isFalse();
        assertThat(e.classification()).isEqualTo("op_no_trust");
    }

    @Test
    void testPermanentTransactionCode() {
        LedgerException e = new LedgerException("bad auth", 400, "tx_bad_auth", List.of());

        assertThat(e.isPermanentRejection()).isTrue();
        assertThat(e.classification()).isEqualTo("tx_bad_auth");
    }

    @Test
    void testTransientResultCodes() {
        LedgerException badSeq = new LedgerException("bad seq", 400, "tx_bad_seq", List.of());
        LedgerException lowFee = new LedgerException("fee", 400, "tx_insufficient_fee", List.of());

        assertThat(badSeq.isTransient()).isTrue();
        assertThat(badSeq.hasResultCodes()).isTrue();
        assertThat(lowFee.isTransient()).isTrue();
        assertThat(lowFee.classification()).isEqualTo("tx_insufficient_fee");
    }

    @Test
    void testHttpErrorsWithoutCodes() {
        LedgerException timeout = new LedgerException("timeout", 504);
        LedgerException rateLimited = new LedgerException("slow down", 429);

        assertThat(timeout.isTimeout()).isTrue();
        assertThat(timeout.isTransient()).isTrue();
        assertThat(timeout.hasResultCodes()).isFalse();
        assertThat(timeout.classification()).isEqualTo("http_504");
        assertThat(rateLimited.isRateLimited()).isTrue();
        assertThat(rateLimited.isTransient()).isTrue();
    }

    @Test
    void testNotFoundIsNeitherTransientNorPermanent() {
        LedgerException notFound = new LedgerException("missing", 404);

        assertThat(notFound.isNotFound()).isTrue();
        assertThat(notFound.isTransient()).isFalse();
        assertThat(notFound.isPermanentRejection()).isFalse();
    }

    @Test
    void testNetworkError() {
        LedgerException e = new LedgerException("connection refused", new IOException("refused"));

        assertThat(e.getStatusCode()).isEqualTo(LedgerException.NO_RESPONSE);
        assertThat(e.isTransient()).isTrue();
        assertThat(e.classification()).isEqualTo("network_error");
    }
}
