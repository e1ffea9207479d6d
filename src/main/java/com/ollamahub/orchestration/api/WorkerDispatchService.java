package com.ollamahub.orchestration.api;

import com.ollamahub.orchestration.exception.AllWorkersFailedException;
import com.ollamahub.orchestration.model.AgentConfig;
import com.ollamahub.orchestration.model.ConversationMessage;
import com.ollamahub.orchestration.model.WorkerDispatch;

import java.util.List;

/**
 * Service interface for fanning one conversation out to every worker agent.
 */
public interface WorkerDispatchService {

    /**
     * Invokes every worker concurrently and waits for all of them to finish.
     * <p>
     * A failing worker never cancels the others. The returned results follow the order of
     * {@code workers}, not the order in which the calls completed.
     *
     * @param workers The worker agents, in configured order.
     * @param messages The conversation sent to each worker.
     * @return One result per worker, with at least one success.
     * @throws AllWorkersFailedException If no worker succeeded.
     */
    WorkerDispatch dispatch(List<AgentConfig> workers, List<ConversationMessage> messages);
}
