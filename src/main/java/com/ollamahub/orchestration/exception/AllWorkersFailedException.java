package com.ollamahub.orchestration.exception;

import com.ollamahub.orchestration.model.GenerationStage;
import com.ollamahub.orchestration.model.WorkerDispatch;
import com.ollamahub.orchestration.model.WorkerResult;

import java.util.stream.Collectors;

/**
 * Raised when no worker produced an answer. The reviewer is never called in that case.
 */
public class AllWorkersFailedException extends GenerationException {

    private final WorkerDispatch dispatch;

    public AllWorkersFailedException(WorkerDispatch dispatch) {
        super("All %d worker agents failed to respond".formatted(dispatch.totalWorkers()), GenerationStage.ALL_FAILED);
        this.dispatch = dispatch;
    }

    public WorkerDispatch getDispatch() {
        return dispatch;
    }

    public String failureSummary() {
        return dispatch.results().stream()
                .map(WorkerResult::errorDetail)
                .collect(Collectors.joining("; "));
    }
}
