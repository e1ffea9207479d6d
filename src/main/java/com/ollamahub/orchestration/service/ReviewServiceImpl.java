package com.ollamahub.orchestration.service;

import com.ollamahub.orchestration.api.AgentInvocationService;
import com.ollamahub.orchestration.api.ReviewService;
import com.ollamahub.orchestration.exception.ReviewerException;
import com.ollamahub.orchestration.model.AgentConfig;
import com.ollamahub.orchestration.model.ConversationMessage;
import com.ollamahub.orchestration.model.InvocationOutcome;
import com.ollamahub.orchestration.model.ReviewOutcome;
import com.ollamahub.orchestration.model.ReviewReply;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewServiceImpl implements ReviewService {

    private final AgentInvocationService agentInvocationService;
    private final ReviewReplyParser reviewReplyParser;

    @Override
    public ReviewOutcome review(AgentConfig reviewer, String reviewMessage) {
        log.info("Sending review request. reviewer={}, model={}.", reviewer.name(), reviewer.model());
        InvocationOutcome outcome = agentInvocationService.invoke(reviewer,
                List.of(ConversationMessage.user(reviewMessage)));
        if (outcome instanceof InvocationOutcome.Failure failure) {
            throw new ReviewerException(reviewer.name(), failure.detail());
        }
        InvocationOutcome.Success success = (InvocationOutcome.Success) outcome;
        if (!StringUtils.hasText(success.content())) {
            throw new ReviewerException(reviewer.name(), "Reviewer returned an empty reply");
        }
        ReviewReply reply = reviewReplyParser.parse(success.content());
        if (reply instanceof ReviewReply.Unstructured) {
            log.warn("Reviewer reply has no final answer section. Using the whole reply as the final answer.");
        }
        log.info("Review complete. reviewer={}, elapsed={} ms.", reviewer.name(), success.elapsed().toMillis());
        return reply.toOutcome();
    }
}
