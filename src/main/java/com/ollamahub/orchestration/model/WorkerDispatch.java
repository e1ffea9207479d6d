package com.ollamahub.orchestration.model;

import java.util.List;

/**
 * Joined outcome of a fan-out: one result per configured worker, in configured order.
 */
public record WorkerDispatch(List<WorkerResult> results) {

    public WorkerDispatch {
        results = List.copyOf(results);
    }

    public int totalWorkers() {
        return results.size();
    }

    public int successfulWorkers() {
        return (int) results.stream().filter(WorkerResult::success).count();
    }

    public int failedWorkers() {
        return totalWorkers() - successfulWorkers();
    }

    public boolean allFailed() {
        return successfulWorkers() == 0;
    }

    public List<WorkerResult> successfulResults() {
        return results.stream().filter(WorkerResult::success).toList();
    }
}
