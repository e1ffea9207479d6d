package com.ollamahub.orchestration.service;

import com.ollamahub.orchestration.api.AgentInvocationService;
import com.ollamahub.orchestration.api.WorkerDispatchService;
import com.ollamahub.orchestration.exception.AllWorkersFailedException;
import com.ollamahub.orchestration.model.AgentConfig;
import com.ollamahub.orchestration.model.ConversationMessage;
import com.ollamahub.orchestration.model.WorkerDispatch;
import com.ollamahub.orchestration.model.WorkerResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Service
@RequiredArgsConstructor
@Slf4j
public class WorkerDispatchServiceImpl implements WorkerDispatchService {

    private static final String WORKER_FAILED_MESSAGE = "Worker failed: ";

    private final AgentInvocationService agentInvocationService;

    @Override
    public WorkerDispatch dispatch(List<AgentConfig> workers, List<ConversationMessage> messages) {
        Assert.notEmpty(workers, "At least one worker agent is required");
        long startedAt = System.nanoTime();
        log.info("Dispatching {} worker agents in parallel.", workers.size());

        // Each task writes only its own slot, so the order never depends on completion timing.
        WorkerResult[] slots = new WorkerResult[workers.size()];
        CompletableFuture<?>[] pending = new CompletableFuture<?>[workers.size()];
        for (int i = 0; i < workers.size(); i++) {
            int slot = i;
            AgentConfig worker = workers.get(i);
            pending[i] = agentInvocationService.invokeAsync(worker, messages)
                    .handle((outcome, ex) -> outcome != null
                            ? WorkerResult.from(outcome)
                            : WorkerResult.failed(worker.name(), WORKER_FAILED_MESSAGE + ex.getMessage(), elapsedSince(startedAt)))
                    .thenAccept(result -> slots[slot] = result);
        }
        CompletableFuture.allOf(pending).join();

        WorkerDispatch dispatch = new WorkerDispatch(Arrays.asList(slots));
        log.info("Worker dispatch complete. succeeded={}/{}, elapsed={} ms.",
                dispatch.successfulWorkers(), dispatch.totalWorkers(), elapsedSince(startedAt).toMillis());
        if (dispatch.allFailed()) {
            throw new AllWorkersFailedException(dispatch);
        }
        return dispatch;
    }

    private static Duration elapsedSince(long startedAt) {
        return Duration.ofNanos(System.nanoTime() - startedAt);
    }
}
