package com.ollamahub.orchestration.exception;

import com.ollamahub.orchestration.model.GenerationStage;

/**
 * Raised when the reviewer call fails after its retries or returns nothing usable.
 */
public class ReviewerException extends GenerationException {

    private final String reviewerName;
    private final String detail;

    public ReviewerException(String reviewerName, String detail) {
        super("Reviewer agent '%s' failed: %s".formatted(reviewerName, detail), GenerationStage.REVIEW_FAILED);
        this.reviewerName = reviewerName;
        this.detail = detail;
    }

    public String getReviewerName() {
        return reviewerName;
    }

    public String getDetail() {
        return detail;
    }
}
