package com.ops.alertdecision.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool running one alert pipeline per task. On shutdown it stops taking work and
 * lets in-flight pipelines finish.
 */
@Configuration
public class WorkerPoolConfig {

    @Bean("alertWorkerExecutor")
    public ThreadPoolTaskExecutor alertWorkerExecutor(AlertDecisionProperties properties) {
        AlertDecisionProperties.Worker worker = properties.getWorker();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(worker.getCorePoolSize());
        executor.setMaxPoolSize(worker.getMaxPoolSize());
        executor.setQueueCapacity(worker.getQueueCapacity());
        executor.setThreadNamePrefix("alert-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(worker.getAwaitTerminationSeconds());
        return executor;
    }
}
