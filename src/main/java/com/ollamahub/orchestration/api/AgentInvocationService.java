package com.ollamahub.orchestration.api;

import com.ollamahub.orchestration.model.AgentConfig;
import com.ollamahub.orchestration.model.ConversationMessage;
import com.ollamahub.orchestration.model.InvocationOutcome;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Service interface for a single conversational round trip to one configured agent, with the
 * agent's timeout and retry budget applied.
 */
public interface AgentInvocationService {

    /**
     * Starts an invocation and returns immediately.
     * <p>
     * Timeouts and connection failures are retried up to {@link AgentConfig#maxRetries()} extra
     * times. Error statuses and malformed payloads fail on the first attempt.
     *
     * @param agent The agent to call.
     * @param messages The conversation to send. Must not be empty.
     * @return A future that always completes normally with the {@link InvocationOutcome}.
     */
    CompletableFuture<InvocationOutcome> invokeAsync(AgentConfig agent, List<ConversationMessage> messages);

    /**
     * Blocking form of {@link #invokeAsync(AgentConfig, List)}.
     *
     * @param agent The agent to call.
     * @param messages The conversation to send. Must not be empty.
     * @return The {@link InvocationOutcome}; failures are reported, never thrown.
     */
    InvocationOutcome invoke(AgentConfig agent, List<ConversationMessage> messages);
}
