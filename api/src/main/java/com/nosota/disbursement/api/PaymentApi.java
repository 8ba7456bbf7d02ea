package com.nosota.disbursement.api;

import com.nosota.disbursement.api.request.PaymentActionRequest;
import com.nosota.disbursement.api.response.PaymentResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Payment administration API.
 *
 * <p>Exposes the administrative transitions of the payment lifecycle. Submission-driven
 * transitions (PENDING, SUCCESS, FAILED) are owned by the submitter and are not exposed here.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>PaymentController - in service module</li>
 *   <li>PaymentClient - in api module</li>
 * </ul>
 */
@RequestMapping("/api/v1/payments")
public interface PaymentApi {

    /**
     * Gets a payment with its status history.
     *
     * @param paymentId Payment UUID
     * @return Payment response
     */
    @GetMapping("/{paymentId}")
    ResponseEntity<PaymentResponse> getPayment(
            @PathVariable("paymentId") UUID paymentId) throws Exception;

    /**
     * Moves a DRAFT payment to READY so the submitter can pick it up.
     */
    @PostMapping("/{paymentId}/ready")
    ResponseEntity<PaymentResponse> markPaymentReady(
            @PathVariable("paymentId") UUID paymentId,
            @RequestBody(required = false) PaymentActionRequest request) throws Exception;

    /**
     * Moves a FAILED payment back to READY and resets its attempt counter.
     */
    @PostMapping("/{paymentId}/retry")
    ResponseEntity<PaymentResponse> retryPayment(
            @PathVariable("paymentId") UUID paymentId,
            @RequestBody(required = false) PaymentActionRequest request) throws Exception;

    /**
     * Cancels a READY or PENDING payment.
     */
    @PostMapping("/{paymentId}/cancel")
    ResponseEntity<PaymentResponse> cancelPayment(
            @PathVariable("paymentId") UUID paymentId,
            @RequestBody(required = false) PaymentActionRequest request) throws Exception;
}
