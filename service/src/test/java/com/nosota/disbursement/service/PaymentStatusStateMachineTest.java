package com.nosota.disbursement.service;

import com.nosota.disbursement.api.model.PaymentStatus;
import com.nosota.disbursement.error.InvalidPaymentStatusTransitionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaymentStatusStateMachineTest {

    private final PaymentStatusStateMachine stateMachine = new PaymentStatusStateMachine();

    @ParameterizedTest
    @CsvSource({
            "DRAFT, READY",
            "READY, PENDING",
            "READY, CANCELED",
            "PENDING, SUCCESS",
            "PENDING, FAILED",
            "PENDING, READY",
            "PENDING, CANCELED",
            "FAILED, READY"
    })
    void testAllowedTransitions(PaymentStatus from, PaymentStatus to) {
        assertThat(stateMachine.isTransitionAllowed(from, to)).isTrue();
        assertThatCode(() -> stateMachine.validateTransition(UUID.randomUUID(), from, to)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @CsvSource({
            "DRAFT, PENDING",
            "READY, SUCCESS",
            "READY, FAILED",
            "FAILED, PENDING",
            "FAILED, CANCELED",
            "SUCCESS, READY",
            "CANCELED, READY"
    })
    void testRejectedTransitions(PaymentStatus from, PaymentStatus to) {
        UUID paymentId = UUID.randomUUID();

        assertThat(stateMachine.isTransitionAllowed(from, to)).isFalse();
        assertThatThrownBy(() -> stateMachine.validateTransition(paymentId, from, to))
                .isInstanceOf(InvalidPaymentStatusTransitionException.class)
                .hasMessageContaining(paymentId.toString());
    }

    @ParameterizedTest
    @EnumSource(PaymentStatus.class)
    void testSelfTransitionRejected(PaymentStatus status) {
        assertThat(stateMachine.isTransitionAllowed(status, status)).isFalse();
    }

    @Test
    void testFinalStates() {
        assertThat(stateMachine.isTransitionAllowed(PaymentStatus.FAILED, PaymentStatus.READY)).isTrue();
        for (PaymentStatus target : PaymentStatus.values()) {
            assertThat(stateMachine.isTransitionAllowed(PaymentStatus.SUCCESS, target)).isFalse();
            assertThat(stateMachine.isTransitionAllowed(PaymentStatus.CANCELED, target)).isFalse();
        }
    }

    @Test
    void testNullStatus() {
        assertThat(stateMachine.isTransitionAllowed(null, PaymentStatus.READY)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(PaymentStatus.READY, null)).isFalse();
    }
}
