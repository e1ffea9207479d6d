package com.ollamahub.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * Outcome of one worker agent. {@code content} is empty and {@code errorDetail} is set exactly
 * when the worker failed.
 */
public record WorkerResult(
        String agentName,
        String content,
        boolean success,
        Duration elapsed,
        @Nullable String errorDetail
) {

    public static WorkerResult succeeded(String agentName, String content, Duration elapsed) {
        return new WorkerResult(agentName, content == null ? "" : content, true, elapsed, null);
    }

    public static WorkerResult failed(String agentName, String errorDetail, Duration elapsed) {
        return new WorkerResult(agentName, "", false, elapsed, errorDetail);
    }

    public static WorkerResult from(InvocationOutcome outcome) {
        if (outcome instanceof InvocationOutcome.Success success) {
            return succeeded(success.agentName(), success.content(), success.elapsed());
        }
        InvocationOutcome.Failure failure = (InvocationOutcome.Failure) outcome;
        return failed(failure.agentName(), failure.detail(), failure.elapsed());
    }
}
