package com.nosota.disbursement.submitter;

import com.nosota.disbursement.config.TssProperties;
import com.nosota.disbursement.model.Payment;
import com.nosota.disbursement.service.PaymentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Submission loop.
 *
 * <p>Each round claims as many READY payments as there are idle workers (capped by
 * {@link TransactionProcessingLimiter}) and hands each one to a {@link TransactionWorker} on the
 * worker pool. When a round finds nothing to do the loop waits for the polling interval.
 *
 * <p>Started and stopped with the application context. On stop no new payments are claimed and
 * in-flight submissions are allowed to finish within the shutdown grace period.
 *
 * <p>Configuration:
 * <pre>
 * tss:
 *   submitter:
 *     enabled: true          # start the loop with the application
 *     polling-interval: 1s   # pause after an empty round
 *     workers: 8             # concurrent submissions
 * </pre>
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "tss.submitter.enabled", havingValue = "true", matchIfMissing = true)
public class TransactionSubmissionManager implements SmartLifecycle {

    private final PaymentService paymentService;
    private final TransactionWorker transactionWorker;
    private final TransactionProcessingLimiter limiter;
    private final TssProperties.Submitter submitter;
    private final ThreadPoolTaskExecutor submitterExecutor;

    private final AtomicInteger inFlight = new AtomicInteger();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean running;
    private Thread loopThread;

    public TransactionSubmissionManager(PaymentService paymentService,
                                        TransactionWorker transactionWorker,
                                        TransactionProcessingLimiter limiter,
                                        TssProperties tssProperties,
                                        @Qualifier("submitterExecutor") ThreadPoolTaskExecutor submitterExecutor) {
        this.paymentService = paymentService;
        this.transactionWorker = transactionWorker;
        this.limiter = limiter;
        this.submitter = tssProperties.getSubmitter();
        this.submitterExecutor = submitterExecutor;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loopThread = new Thread(this::run, "tss-submitter-loop");
        loopThread.start();
        log.info("Transaction submission started: workers={}, batchSize={}, pollingInterval={}",
                submitter.getWorkers(), submitter.getBatchSize(), submitter.getPollingInterval());
    }

    /**
     * Runs claim rounds until {@link #stop()} is called. Blocks the calling thread.
     */
    public void run() {
        while (running) {
            boolean claimedAny = false;
            try {
                claimedAny = runRound();
            } catch (RuntimeException e) {
                log.error("Submission round failed: {}", e.getMessage(), e);
            }
            if (!claimedAny && awaitStop(submitter.getPollingInterval().toMillis())) {
                break;
            }
        }
        log.info("Transaction submission loop exited");
    }

    /**
     * @return true if at least one payment was handed to a worker
     */
    boolean runRound() {
        int idleWorkers = submitter.getWorkers() - inFlight.get();
        int limit = Math.min(idleWorkers, limiter.getLimit());
        if (limit <= 0) {
            return false;
        }

        List<Payment> claimed = paymentService.claimBatch(limit, submitter.getDirectPaymentShare());
        for (Payment payment : claimed) {
            inFlight.incrementAndGet();
            try {
                submitterExecutor.execute(() -> {
                    try {
                        SubmissionOutcome outcome = transactionWorker.process(payment);
                        log.debug("Payment processed: paymentId={}, outcome={}", payment.getId(), outcome);
                    } catch (RuntimeException e) {
                        log.error("Unexpected error processing payment: paymentId={}", payment.getId(), e);
                    } finally {
                        inFlight.decrementAndGet();
                    }
                });
            } catch (RuntimeException e) {
                // rejected by the pool: the payment stays PENDING until the lease sweep requeues it
                inFlight.decrementAndGet();
                log.error("Worker pool rejected payment: paymentId={}", payment.getId(), e);
            }
        }
        return !claimed.isEmpty();
    }

    @Override
    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            stopSignal.countDown();
        }
        log.info("Stopping transaction submission: inFlight={}", inFlight.get());

        try {
            loopThread.join(submitter.getShutdownGracePeriod().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the submission loop to exit");
        }

        // waits for in-flight workers up to the grace period
        submitterExecutor.shutdown();
        log.info("Transaction submission stopped: unfinished={}", inFlight.get());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public int getInFlight() {
        return inFlight.get();
    }

    private boolean awaitStop(long millis) {
        try {
            return stopSignal.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
