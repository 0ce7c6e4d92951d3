package com.ops.alertdecision.service;

import com.ops.alertdecision.config.MetricsConfig;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.WorkflowRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs alert workflows on the worker pool. Each alert is one independent task; tasks share
 * only the history store and the audit log.
 */
@Service
public class AlertProcessingService {

    private static final Logger log = LoggerFactory.getLogger(AlertProcessingService.class);

    private final AlertWorkflowService workflowService;
    private final ThreadPoolTaskExecutor executor;
    private final MetricsConfig metricsConfig;

    public AlertProcessingService(AlertWorkflowService workflowService,
                                  @Qualifier("alertWorkerExecutor") ThreadPoolTaskExecutor executor,
                                  MetricsConfig metricsConfig) {
        this.workflowService = workflowService;
        this.executor = executor;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Queue one alert.
     *
     * @throws TaskRejectedException when the queue is full or the pool is shutting down
     */
    public CompletableFuture<WorkflowRecord> submit(Alert alert) {
        try {
            return CompletableFuture.supplyAsync(() -> workflowService.process(alert), executor);
        } catch (TaskRejectedException e) {
            metricsConfig.recordRejected();
            log.warn("Worker pool rejected alert {}: {}", alert.getAlertId(), e.getMessage());
            throw e;
        }
    }

    /**
     * Queue every alert, then wait for all of them. Records come back in input order.
     * If the pool rejects part of the batch, already-queued alerts still run to completion.
     */
    public List<WorkflowRecord> processBatch(List<Alert> alerts) {
        List<CompletableFuture<WorkflowRecord>> futures = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            futures.add(submit(alert));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<WorkflowRecord> records = new ArrayList<>(futures.size());
        for (CompletableFuture<WorkflowRecord> future : futures) {
            records.add(future.join());
        }
        log.info("Processed batch of {} alerts", records.size());
        return records;
    }
}
