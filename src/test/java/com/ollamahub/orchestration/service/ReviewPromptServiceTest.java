package com.ollamahub.orchestration.service;

import com.ollamahub.orchestration.model.ConversationMessage;
import com.ollamahub.orchestration.model.MessageRole;
import com.ollamahub.orchestration.model.WorkerResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReviewPromptServiceTest {

    private final ReviewPromptService service = new ReviewPromptService();

    private static final List<WorkerResult> RESULTS = List.of(
            WorkerResult.succeeded("Worker A", "x", Duration.ofMillis(10)),
            WorkerResult.failed("Worker B", "boom", Duration.ofMillis(20)),
            WorkerResult.succeeded("Worker C", "y", Duration.ofMillis(30)));

    @Test
    void testOnlySuccessfulAnswersAreIncluded() {
        String prompt = service.build("What is 2+2?", List.of(), RESULTS);

        assertTrue(prompt.contains("[Agent: Worker A]\nx"));
        assertTrue(prompt.contains("[Agent: Worker C]\ny"));
        assertFalse(prompt.contains("boom"));
        assertFalse(prompt.contains("Worker B"));
    }

    @Test
    void testAnswersKeepDispatchOrder() {
        String prompt = service.build("What is 2+2?", List.of(), RESULTS);

        assertTrue(prompt.indexOf("[Agent: Worker A]") < prompt.indexOf("[Agent: Worker C]"));
    }

    @Test
    void testContainsQuestionAndOutputContract() {
        String prompt = service.build("What is 2+2?", List.of(), RESULTS);

        assertTrue(prompt.contains("# User question:\nWhat is 2+2?"));
        int review = prompt.indexOf("## Review");
        int finalAnswer = prompt.indexOf("## Final Answer");
        assertTrue(review >= 0);
        assertTrue(finalAnswer > review);
        assertFalse(prompt.contains("# Conversation so far:"));
    }

    @Test
    void testRendersHistoryWithoutSystemTurns() {
        List<ConversationMessage> history = List.of(
                new ConversationMessage(MessageRole.SYSTEM, "secret system instructions"),
                ConversationMessage.user("Capital of France?"),
                ConversationMessage.assistant("Paris"));

        String prompt = service.build("And of Italy?", history, RESULTS);

        assertTrue(prompt.contains("# Conversation so far:"));
        assertTrue(prompt.contains("[User]\nCapital of France?"));
        assertTrue(prompt.contains("[Final Answer]\nParis"));
        assertFalse(prompt.contains("secret system instructions"));
        assertTrue(prompt.indexOf("Capital of France?") < prompt.indexOf("And of Italy?"));
    }

    @Test
    void testIsDeterministic() {
        assertEquals(service.build("q", List.of(), RESULTS), service.build("q", List.of(), RESULTS));
    }

    @Test
    void testRequiresSuccessfulAnswer() {
        List<WorkerResult> failures = List.of(WorkerResult.failed("Worker B", "boom", Duration.ZERO));

        assertThrows(IllegalArgumentException.class, () -> service.build("q", List.of(), failures));
    }
}
