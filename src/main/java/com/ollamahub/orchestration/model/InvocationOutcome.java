package com.ollamahub.orchestration.model;

import java.time.Duration;

/**
 * Result of one agent invocation, including every retry. Invocations report failures through
 * this value instead of throwing.
 */
public sealed interface InvocationOutcome permits InvocationOutcome.Success, InvocationOutcome.Failure {

    String agentName();

    /** Wall time across all attempts. */
    Duration elapsed();

    int attempts();

    boolean isSuccess();

    record Success(String agentName, String content, Duration elapsed, int attempts) implements InvocationOutcome {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(String agentName, FailureKind kind, String detail, Duration elapsed, int attempts)
            implements InvocationOutcome {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
