package com.ollamahub.orchestration.model;

/**
 * Parsed reviewer reply. {@link Unstructured} marks the degraded mode where the reviewer
 * ignored the requested layout and the whole reply becomes the final answer.
 */
public sealed interface ReviewReply permits ReviewReply.Structured, ReviewReply.Unstructured {

    String finalAnswer();

    ReviewOutcome toOutcome();

    record Structured(String review, String finalAnswer) implements ReviewReply {
        @Override
        public ReviewOutcome toOutcome() {
            return new ReviewOutcome(review, finalAnswer);
        }
    }

    record Unstructured(String finalAnswer) implements ReviewReply {
        @Override
        public ReviewOutcome toOutcome() {
            return new ReviewOutcome("", finalAnswer);
        }
    }
}
