package com.cred.freestyle.erp.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for background restores.
 *
 * A single worker thread: restores are queued and run one at a time, in submission order.
 * Queued restores are drained on shutdown rather than dropped.
 *
 * @author ERP Platform Team
 */
@Configuration
public class RestoreExecutorConfig {

    public static final String RESTORE_EXECUTOR = "restoreTaskExecutor";

    @Bean(name = RESTORE_EXECUTOR)
    public ThreadPoolTaskExecutor restoreTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("restore-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(300);
        return executor;
    }
}
