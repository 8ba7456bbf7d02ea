package com.nosota.disbursement.controller;

import com.nosota.disbursement.api.PaymentApi;
import com.nosota.disbursement.api.request.PaymentActionRequest;
import com.nosota.disbursement.api.response.PaymentResponse;
import com.nosota.disbursement.service.PaymentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for operator actions on payments.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class PaymentController implements PaymentApi {

    private final PaymentService paymentService;

    @Override
    public ResponseEntity<PaymentResponse> getPayment(UUID paymentId) throws Exception {
        return ResponseEntity.ok(paymentService.getPayment(paymentId));
    }

    @Override
    public ResponseEntity<PaymentResponse> markPaymentReady(UUID paymentId, PaymentActionRequest request) throws Exception {
        return ResponseEntity.ok(paymentService.markReady(paymentId, messageOf(request)));
    }

    @Override
    public ResponseEntity<PaymentResponse> retryPayment(UUID paymentId, PaymentActionRequest request) throws Exception {
        log.info("Retry requested: paymentId={}", paymentId);
        return ResponseEntity.ok(paymentService.retry(paymentId, messageOf(request)));
    }

    @Override
    public ResponseEntity<PaymentResponse> cancelPayment(UUID paymentId, PaymentActionRequest request) throws Exception {
        log.info("Cancellation requested: paymentId={}", paymentId);
        return ResponseEntity.ok(paymentService.cancel(paymentId, messageOf(request)));
    }

    private static String messageOf(PaymentActionRequest request) {
        return request == null ? null : request.message();
    }
}
