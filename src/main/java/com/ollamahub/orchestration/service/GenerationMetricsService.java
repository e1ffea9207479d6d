package com.ollamahub.orchestration.service;

import com.ollamahub.orchestration.model.WorkerDispatch;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class GenerationMetricsService {

    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong completedCount = new AtomicLong();
    private final AtomicLong workerSuccessCount = new AtomicLong();
    private final AtomicLong workerFailureCount = new AtomicLong();
    private final AtomicLong allWorkersFailedCount = new AtomicLong();
    private final AtomicLong reviewerFailureCount = new AtomicLong();

    public void recordRequest(String requestId, int workers) {
        long count = requestCount.incrementAndGet();
        log.info("Generate request #{} received (id={}, workers={}).", count, requestId, workers);
    }

    public void recordWorkerOutcomes(WorkerDispatch dispatch) {
        long successes = workerSuccessCount.addAndGet(dispatch.successfulWorkers());
        long failures = workerFailureCount.addAndGet(dispatch.failedWorkers());
        log.debug("Worker outcomes recorded. totalSucceeded={}, totalFailed={}.", successes, failures);
    }

    public void recordAllWorkersFailed() {
        allWorkersFailedCount.incrementAndGet();
    }

    public void recordReviewerFailure() {
        reviewerFailureCount.incrementAndGet();
    }

    public void recordCompleted(String requestId, Duration processingTime) {
        long count = completedCount.incrementAndGet();
        log.info("Generate request {} completed in {} ms. Total completed={}.", requestId, processingTime.toMillis(), count);
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public long getCompletedCount() {
        return completedCount.get();
    }

    public long getWorkerFailureCount() {
        return workerFailureCount.get();
    }

    public long getReviewerFailureCount() {
        return reviewerFailureCount.get();
    }

    @PreDestroy
    public void logSummary() {
        log.info("Generation stats: requests={}, completed={}, workerSuccesses={}, workerFailures={}, allWorkersFailed={}, reviewerFailures={}.",
                requestCount.get(), completedCount.get(), workerSuccessCount.get(), workerFailureCount.get(),
                allWorkersFailedCount.get(), reviewerFailureCount.get());
    }
}
