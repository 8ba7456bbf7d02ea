package com.nosota.disbursement.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool of the submission loop. Sized to the configured worker count; the loop never hands
 * out more work than there are idle workers, so the queue only absorbs hand-over races.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(value = "tss.submitter.enabled", havingValue = "true", matchIfMissing = true)
public class SubmitterConfig {

    @Bean(name = "submitterExecutor")
    public ThreadPoolTaskExecutor submitterExecutor(TssProperties tssProperties) {
        TssProperties.Submitter submitter = tssProperties.getSubmitter();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(submitter.getWorkers());
        executor.setMaxPoolSize(submitter.getWorkers());
        executor.setQueueCapacity(submitter.getWorkers());
        executor.setThreadNamePrefix("tss-worker-");

        // in-flight submissions finish, an aborted broadcast cannot be undone
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(submitter.getShutdownGracePeriod().toMillis());
        executor.initialize();

        log.info("Initialized submitter executor: workers={}, gracePeriod={}",
                submitter.getWorkers(), submitter.getShutdownGracePeriod());
        return executor;
    }
}
