package com.github.dimitryivaniuta.outreach.passes.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Beans used by the worker pass.
 */
@Configuration
public class WorkerConfig {

    /**
     * Bean name of the executor running issuance pipelines.
     */
    public static final String ISSUANCE_EXECUTOR = "passIssuanceExecutor";

    /**
     * UTC clock; replaced in tests.
     *
     * @return clock
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool for the jobs of one batch. The queue holds a full batch so submission never blocks.
     *
     * @param properties app properties
     * @return executor
     */
    @Bean(name = ISSUANCE_EXECUTOR)
    public ThreadPoolTaskExecutor passIssuanceExecutor(AppProperties properties) {
        AppProperties.Worker worker = properties.getWorker();
        int threads = Math.max(1, worker.getParallelism());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("pass-issuance-");
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(worker.getBatchSize(), 1) * 2);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
