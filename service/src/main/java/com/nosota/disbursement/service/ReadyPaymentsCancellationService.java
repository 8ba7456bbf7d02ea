package com.nosota.disbursement.service;

import com.nosota.disbursement.api.model.PaymentStatus;
import com.nosota.disbursement.model.Payment;
import com.nosota.disbursement.model.Tenant;
import com.nosota.disbursement.repository.PaymentRepository;
import com.nosota.disbursement.repository.TenantRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Cancels payments left in READY for longer than their tenant's cancellation period.
 *
 * <p>The age of a payment is taken from its latest READY history entry, so a payment that was
 * retried recently is not canceled for having been created long ago.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReadyPaymentsCancellationService {

    private final TenantRepository tenantRepository;
    private final PaymentRepository paymentRepository;

    /**
     * @return Number of canceled payments across all tenants
     */
    @Transactional
    public int cancelExpiredReadyPayments() {
        int canceled = 0;
        LocalDateTime now = LocalDateTime.now();

        for (Tenant tenant : tenantRepository.findByPaymentCancellationPeriodDaysIsNotNull()) {
            int periodDays = tenant.getPaymentCancellationPeriodDays();
            if (periodDays <= 0) {
                log.warn("Ignoring non positive payment cancellation period: tenantId={}, days={}",
                        tenant.getId(), periodDays);
                continue;
            }

            List<Payment> expired = paymentRepository.findReadyToCancel(tenant.getId(), now.minusDays(periodDays));
            for (Payment payment : expired) {
                payment.setStatus(PaymentStatus.CANCELED);
                PaymentService.appendHistory(payment, PaymentStatus.CANCELED,
                        String.format("canceled automatically after %d day(s) in READY", periodDays), now);
                payment.setUpdatedAt(now);
            }
            paymentRepository.saveAll(expired);

            if (!expired.isEmpty()) {
                log.info("Canceled expired READY payments: tenantId={}, count={}, periodDays={}",
                        tenant.getId(), expired.size(), periodDays);
            }
            canceled += expired.size();
        }
        return canceled;
    }
}
