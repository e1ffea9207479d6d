package com.ollamahub.orchestration.api;

import com.ollamahub.orchestration.exception.ReviewerException;
import com.ollamahub.orchestration.model.AgentConfig;
import com.ollamahub.orchestration.model.ReviewOutcome;

/**
 * Service interface for the reviewer step that critiques and merges worker answers.
 */
public interface ReviewService {

    /**
     * Sends the review instruction to the reviewer and splits the reply into critique and answer.
     *
     * @param reviewer The reviewer agent.
     * @param reviewMessage The instruction built from the successful worker answers.
     * @return The {@link ReviewOutcome}; its final answer is never empty.
     * @throws ReviewerException If the reviewer failed after its retries or replied with nothing.
     */
    ReviewOutcome review(AgentConfig reviewer, String reviewMessage);
}
