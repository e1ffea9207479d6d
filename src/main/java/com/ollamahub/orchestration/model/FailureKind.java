package com.ollamahub.orchestration.model;

/**
 * Classification of a failed round trip. Only transient kinds are retried.
 */
public enum FailureKind {
    TIMEOUT(true),
    CONNECTION(true),
    PROTOCOL(false),
    MALFORMED(false),
    UNEXPECTED(false);

    private final boolean transientFailure;

    FailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
