package com.ollamahub.orchestration.model;

/**
 * Stages a single generate request moves through. {@link #DONE} and {@link #ERROR} are terminal.
 */
public enum GenerationStage {
    DISPATCHED,
    WORKERS_JOINED,
    ALL_FAILED,
    REVIEW_DISPATCHED,
    REVIEW_DONE,
    REVIEW_FAILED,
    DONE,
    ERROR
}
