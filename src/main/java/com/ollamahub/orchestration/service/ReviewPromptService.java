package com.ollamahub.orchestration.service;

import static com.ollamahub.orchestration.OrchestrationConstants.*;

import com.ollamahub.orchestration.model.ConversationMessage;
import com.ollamahub.orchestration.model.MessageRole;
import com.ollamahub.orchestration.model.WorkerResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the single instruction message sent to the reviewer. Output depends only on the
 * arguments.
 */
@Service
@Slf4j
public class ReviewPromptService {

    /**
     * @param userPrompt the latest user request
     * @param history earlier turns of the conversation; only user and assistant turns are rendered
     * @param results worker results in dispatch order; failed results are skipped
     */
    public String build(String userPrompt, List<ConversationMessage> history, List<WorkerResult> results) {
        Assert.hasText(userPrompt, "User prompt must not be empty");
        List<WorkerResult> answers = results.stream().filter(WorkerResult::success).toList();
        Assert.notEmpty(answers, "At least one successful worker result is required");

        List<String> parts = new ArrayList<>();
        parts.add(REVIEW_PROMPT_INTRO);
        appendHistory(parts, history);
        parts.add("");
        parts.add(QUESTION_SECTION_TITLE);
        parts.add(userPrompt);
        parts.add("");
        parts.add(ANSWERS_SECTION_TITLE);
        for (WorkerResult answer : answers) {
            parts.add(WORKER_SECTION_DELIMITER);
            parts.add(WORKER_SECTION_HEADER.formatted(answer.agentName()));
            parts.add(answer.content());
        }
        parts.add(WORKER_SECTION_DELIMITER);
        parts.add("");
        parts.add(REVIEW_TASK_INSTRUCTIONS);

        String prompt = String.join("\n", parts);
        log.debug("Review prompt built. characters={}, answers={}.", prompt.length(), answers.size());
        return prompt;
    }

    private void appendHistory(List<String> parts, List<ConversationMessage> history) {
        if (history == null) {
            return;
        }
        List<ConversationMessage> turns = history.stream()
                .filter(message -> message.role() != MessageRole.SYSTEM)
                .toList();
        if (turns.isEmpty()) {
            return;
        }
        parts.add("");
        parts.add(HISTORY_SECTION_TITLE);
        for (ConversationMessage turn : turns) {
            parts.add(turn.role() == MessageRole.USER ? HISTORY_USER_LABEL : HISTORY_ASSISTANT_LABEL);
            parts.add(turn.content());
            parts.add("");
        }
    }
}
