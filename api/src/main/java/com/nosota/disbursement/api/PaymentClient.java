package com.nosota.disbursement.api;

import com.nosota.disbursement.api.request.PaymentActionRequest;
import com.nosota.disbursement.api.response.PaymentResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;

/**
 * WebClient-based implementation of PaymentApi.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 */
@RequiredArgsConstructor
@Slf4j
public class PaymentClient implements PaymentApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<PaymentResponse> getPayment(UUID paymentId) {
        log.debug("Calling getPayment: paymentId={}", paymentId);

        return webClient.get()
                .uri("/api/v1/payments/{paymentId}", paymentId)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PaymentResponse> markPaymentReady(UUID paymentId, PaymentActionRequest request) {
        log.debug("Calling markPaymentReady: paymentId={}", paymentId);
        return postAction("/api/v1/payments/{paymentId}/ready", paymentId, request);
    }

    @Override
    public ResponseEntity<PaymentResponse> retryPayment(UUID paymentId, PaymentActionRequest request) {
        log.debug("Calling retryPayment: paymentId={}", paymentId);
        return postAction("/api/v1/payments/{paymentId}/retry", paymentId, request);
    }

    @Override
    public ResponseEntity<PaymentResponse> cancelPayment(UUID paymentId, PaymentActionRequest request) {
        log.debug("Calling cancelPayment: paymentId={}", paymentId);
        return postAction("/api/v1/payments/{paymentId}/cancel", paymentId, request);
    }

    private ResponseEntity<PaymentResponse> postAction(String uri, UUID paymentId, PaymentActionRequest request) {
        return webClient.post()
                .uri(uri, paymentId)
                .bodyValue(request != null ? request : new PaymentActionRequest(null))
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }
}
