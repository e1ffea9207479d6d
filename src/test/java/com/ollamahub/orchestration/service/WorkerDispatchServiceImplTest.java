package com.ollamahub.orchestration.service;

import com.ollamahub.client.ChatEndpointClient;
import com.ollamahub.orchestration.api.AgentInvocationService;
import com.ollamahub.orchestration.exception.AllWorkersFailedException;
import com.ollamahub.orchestration.model.AgentConfig;
import com.ollamahub.orchestration.model.ConversationMessage;
import com.ollamahub.orchestration.model.WorkerDispatch;
import com.ollamahub.orchestration.model.WorkerResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WorkerDispatchServiceImplTest {

    private static final List<ConversationMessage> MESSAGES = List.of(ConversationMessage.user("question"));

    private static final AgentConfig WORKER_A = worker("Worker A");
    private static final AgentConfig WORKER_B = worker("Worker B");
    private static final AgentConfig WORKER_C = worker("Worker C");
    private static final List<AgentConfig> WORKERS = List.of(WORKER_A, WORKER_B, WORKER_C);

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static AgentConfig worker(String name) {
        return AgentConfig.worker(name, "http://" + name.replace(' ', '-').toLowerCase() + ".test", "model",
                Duration.ofSeconds(5), 0);
    }

    private WorkerDispatchServiceImpl dispatcherFor(ChatEndpointClient client) {
        return new WorkerDispatchServiceImpl(new AgentInvocationServiceImpl(client, executor));
    }

    @Test
    void testResultsFollowConfiguredOrderRegardlessOfCompletionOrder() {
        ChatEndpointClient client = (agent, messages) -> {
            try {
                switch (agent.name()) {
                    case "Worker A" -> Thread.sleep(300);
                    case "Worker B" -> Thread.sleep(150);
                    default -> { }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return "answer from " + agent.name();
        };

        WorkerDispatch dispatch = dispatcherFor(client).dispatch(WORKERS, MESSAGES);

        assertEquals(List.of("Worker A", "Worker B", "Worker C"),
                dispatch.results().stream().map(WorkerResult::agentName).toList());
        assertEquals("answer from Worker A", dispatch.results().get(0).content());
        assertEquals("answer from Worker C", dispatch.results().get(2).content());
    }

    @Test
    void testAllWorkersStartBeforeAnyIsAwaited() {
        CountDownLatch started = new CountDownLatch(WORKERS.size());
        ChatEndpointClient client = (agent, messages) -> {
            started.countDown();
            try {
                if (!started.await(2, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("Workers were not running concurrently");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return "ok";
        };

        WorkerDispatch dispatch = dispatcherFor(client).dispatch(WORKERS, MESSAGES);

        assertEquals(3, dispatch.successfulWorkers());
    }

    @Test
    void testPartialFailureKeepsOneResultPerWorker() {
        ChatEndpointClient client = (agent, messages) -> {
            if (agent.name().equals("Worker B")) {
                throw new ResourceAccessException("I/O error", new ConnectException("Connection refused"));
            }
            return "fine";
        };

        WorkerDispatch dispatch = dispatcherFor(client).dispatch(WORKERS, MESSAGES);

        assertEquals(3, dispatch.totalWorkers());
        assertEquals(2, dispatch.successfulWorkers());
        assertEquals(1, dispatch.failedWorkers());
        WorkerResult failed = dispatch.results().get(1);
        assertFalse(failed.success());
        assertEquals("", failed.content());
        assertTrue(failed.errorDetail().startsWith("Connection failed"));
        assertNull(dispatch.results().get(0).errorDetail());
    }

    @Test
    void testAllWorkersFailedThrows() {
        ChatEndpointClient client = (agent, messages) -> {
            throw new ResourceAccessException("I/O error", new ConnectException("Connection refused"));
        };

        AllWorkersFailedException ex = assertThrows(AllWorkersFailedException.class,
                () -> dispatcherFor(client).dispatch(WORKERS, MESSAGES));

        assertEquals(3, ex.getDispatch().failedWorkers());
        assertEquals(3, ex.getDispatch().results().size());
        assertTrue(ex.failureSummary().contains("Connection failed"));
    }

    @Test
    void testExceptionalInvocationBecomesFailedResult() {
        AgentInvocationService invocationService = mock(AgentInvocationService.class);
        when(invocationService.invokeAsync(eq(WORKER_A), anyList()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("lost")));
        when(invocationService.invokeAsync(eq(WORKER_B), anyList()))
                .thenReturn(CompletableFuture.completedFuture(
                        new com.ollamahub.orchestration.model.InvocationOutcome.Success("Worker B", "b", Duration.ZERO, 1)));

        WorkerDispatch dispatch = new WorkerDispatchServiceImpl(invocationService)
                .dispatch(List.of(WORKER_A, WORKER_B), MESSAGES);

        assertEquals("Worker A", dispatch.results().get(0).agentName());
        assertFalse(dispatch.results().get(0).success());
        assertTrue(dispatch.results().get(0).errorDetail().contains("lost"));
        assertTrue(dispatch.results().get(1).success());
    }
}
