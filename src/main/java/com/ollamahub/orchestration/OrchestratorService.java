package com.ollamahub.orchestration;

import com.ollamahub.config.AgentCatalog;
import com.ollamahub.orchestration.api.ReviewService;
import com.ollamahub.orchestration.api.WorkerDispatchService;
import com.ollamahub.orchestration.exception.AllWorkersFailedException;
import com.ollamahub.orchestration.exception.ReviewerException;
import com.ollamahub.orchestration.model.AggregatedResponse;
import com.ollamahub.orchestration.model.ConversationMessage;
import com.ollamahub.orchestration.model.GenerationStage;
import com.ollamahub.orchestration.model.MessageRole;
import com.ollamahub.orchestration.model.ReviewOutcome;
import com.ollamahub.orchestration.model.WorkerDispatch;
import com.ollamahub.orchestration.service.GenerationMetricsService;
import com.ollamahub.orchestration.service.ResultComposer;
import com.ollamahub.orchestration.service.ReviewPromptService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Runs one generate request: worker fan-out, review prompt, reviewer call and composition.
 * Only {@link AllWorkersFailedException} and {@link ReviewerException} escape; every per-worker
 * failure stays inside the returned worker results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrchestratorService {

    private final AgentCatalog agentCatalog;
    private final WorkerDispatchService workerDispatchService;
    private final ReviewPromptService reviewPromptService;
    private final ReviewService reviewService;
    private final ResultComposer resultComposer;
    private final GenerationMetricsService metricsService;

    public AggregatedResponse generate(String prompt) {
        Assert.hasText(prompt, "Prompt must not be empty");
        return generate(List.of(ConversationMessage.user(prompt.strip())));
    }

    /**
     * @param conversation the message history, oldest first; the last message must come from the user
     */
    public AggregatedResponse generate(List<ConversationMessage> conversation) {
        Assert.notEmpty(conversation, "Conversation must not be empty");
        ConversationMessage latest = conversation.get(conversation.size() - 1);
        Assert.isTrue(latest.role() == MessageRole.USER, "The last message must come from the user");

        String requestId = UUID.randomUUID().toString().substring(0, 8);
        long startedAt = System.nanoTime();
        metricsService.recordRequest(requestId, agentCatalog.workers().size());
        transition(requestId, GenerationStage.DISPATCHED);

        WorkerDispatch dispatch;
        try {
            dispatch = workerDispatchService.dispatch(agentCatalog.workers(), conversation);
        } catch (AllWorkersFailedException ex) {
            metricsService.recordWorkerOutcomes(ex.getDispatch());
            metricsService.recordAllWorkersFailed();
            transition(requestId, GenerationStage.ALL_FAILED);
            log.error("[{}] All {} workers failed: {}", requestId, ex.getDispatch().totalWorkers(), ex.failureSummary());
            transition(requestId, GenerationStage.ERROR);
            throw ex;
        }
        metricsService.recordWorkerOutcomes(dispatch);
        transition(requestId, GenerationStage.WORKERS_JOINED);
        log.info("[{}] Workers joined. succeeded={}, failed={}.", requestId,
                dispatch.successfulWorkers(), dispatch.failedWorkers());

        List<ConversationMessage> history = conversation.subList(0, conversation.size() - 1);
        String reviewMessage = reviewPromptService.build(latest.content(), history, dispatch.successfulResults());

        transition(requestId, GenerationStage.REVIEW_DISPATCHED);
        ReviewOutcome review;
        try {
            review = reviewService.review(agentCatalog.reviewer(), reviewMessage);
        } catch (ReviewerException ex) {
            metricsService.recordReviewerFailure();
            transition(requestId, GenerationStage.REVIEW_FAILED);
            log.error("[{}] {}", requestId, ex.getMessage());
            transition(requestId, GenerationStage.ERROR);
            throw ex;
        }
        transition(requestId, GenerationStage.REVIEW_DONE);

        Duration processingTime = Duration.ofNanos(System.nanoTime() - startedAt);
        AggregatedResponse response = resultComposer.compose(dispatch, review, processingTime);
        transition(requestId, GenerationStage.DONE);
        metricsService.recordCompleted(requestId, processingTime);
        return response;
    }

    private void transition(String requestId, GenerationStage stage) {
        log.debug("[{}] -> {}", requestId, stage);
    }
}
