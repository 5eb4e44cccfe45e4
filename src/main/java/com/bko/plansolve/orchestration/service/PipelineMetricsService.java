package com.bko.plansolve.orchestration.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class PipelineMetricsService {

    private final AtomicLong llmRequestCount = new AtomicLong();
    private final AtomicLong planCount = new AtomicLong();
    private final AtomicLong taskReceivedCount = new AtomicLong();
    private final AtomicLong attemptCount = new AtomicLong();
    private final AtomicLong retryCount = new AtomicLong();
    private final AtomicLong taskFailedCount = new AtomicLong();
    private final AtomicLong pipelineCompletedCount = new AtomicLong();

    public void recordLlmRequest(String purpose) {
        long count = llmRequestCount.incrementAndGet();
        log.debug("LLM request #{} sent (purpose={}).", count, purpose);
    }

    public void recordPlan(String sessionId, int taskCount) {
        long plans = planCount.incrementAndGet();
        long totalTasks = taskReceivedCount.addAndGet(taskCount);
        log.info("Plan #{} for session {} has {} tasks. Total plans={}, total tasks received={}.",
                plans, sessionId, taskCount, plans, totalTasks);
    }

    public void recordAttempt() {
        attemptCount.incrementAndGet();
    }

    public void recordRetry() {
        retryCount.incrementAndGet();
    }

    public void recordTaskFailed() {
        taskFailedCount.incrementAndGet();
    }

    public void recordPipelineCompleted(String sessionId, String status) {
        long completed = pipelineCompletedCount.incrementAndGet();
        log.info("Pipeline for session {} finished with status {}. Total finished={}.", sessionId, status, completed);
    }

    public long attempts() {
        return attemptCount.get();
    }

    public long retries() {
        return retryCount.get();
    }

    public long pipelinesCompleted() {
        return pipelineCompletedCount.get();
    }

    public long failedTasks() {
        return taskFailedCount.get();
    }

    public long llmRequests() {
        return llmRequestCount.get();
    }
}
