package com.ollamahub.orchestration.service;

import static com.ollamahub.orchestration.OrchestrationConstants.*;

import com.ollamahub.client.ChatEndpointClient;
import com.ollamahub.orchestration.api.AgentInvocationService;
import com.ollamahub.orchestration.exception.MalformedResponseException;
import com.ollamahub.orchestration.model.AgentConfig;
import com.ollamahub.orchestration.model.ConversationMessage;
import com.ollamahub.orchestration.model.FailureKind;
import com.ollamahub.orchestration.model.InvocationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

@Service
@Slf4j
public class AgentInvocationServiceImpl implements AgentInvocationService {

    static final Duration ABANDON_GRACE = Duration.ofSeconds(2);

    private final ChatEndpointClient chatEndpointClient;
    private final ExecutorService workerExecutor;

    public AgentInvocationServiceImpl(ChatEndpointClient chatEndpointClient,
                                      @Qualifier("workerExecutor") ExecutorService workerExecutor) {
        this.chatEndpointClient = chatEndpointClient;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public CompletableFuture<InvocationOutcome> invokeAsync(AgentConfig agent, List<ConversationMessage> messages) {
        Assert.notNull(agent, "Agent must not be null");
        Assert.notEmpty(messages, "Messages must not be empty");
        List<ConversationMessage> conversation = List.copyOf(messages);
        log.info("[{}] Sending request. model={}, messages={}.", agent.name(), agent.model(), conversation.size());
        return attempt(agent, conversation, 1, System.nanoTime());
    }

    @Override
    public InvocationOutcome invoke(AgentConfig agent, List<ConversationMessage> messages) {
        return invokeAsync(agent, messages).join();
    }

    private CompletableFuture<InvocationOutcome> attempt(AgentConfig agent,
                                                         List<ConversationMessage> messages,
                                                         int attempt,
                                                         long startedAt) {
        RunningCall running = new RunningCall();
        CompletableFuture<String> call;
        try {
            call = CompletableFuture
                    .supplyAsync(() -> running.run(() -> chatEndpointClient.chat(agent, messages)), workerExecutor)
                    .orTimeout(agent.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            call = CompletableFuture.failedFuture(ex);
        }
        return call
                .handle((content, error) -> {
                    if (error == null) {
                        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
                        log.info("[{}] Response received. attempt={}, elapsed={} ms.",
                                agent.name(), attempt, elapsed.toMillis());
                        return CompletableFuture.<InvocationOutcome>completedFuture(
                                new InvocationOutcome.Success(agent.name(), content, elapsed, attempt));
                    }
                    Throwable cause = unwrap(error);
                    FailureKind kind = classify(cause);
                    String detail = describe(kind, cause, agent);
                    // A timed-out call is stopped before the next attempt hits the same endpoint.
                    CompletableFuture<Void> settled = cause instanceof TimeoutException
                            ? running.abort(ABANDON_GRACE)
                            : CompletableFuture.completedFuture(null);
                    return settled.thenCompose(ignored -> {
                        if (running.isRunning()) {
                            log.warn("[{}] Attempt {} still running {} ms after it was interrupted.",
                                    agent.name(), attempt, ABANDON_GRACE.toMillis());
                        }
                        return afterFailure(agent, messages, attempt, startedAt, kind, detail, cause);
                    });
                })
                .thenCompose(Function.identity());
    }

    private CompletableFuture<InvocationOutcome> afterFailure(AgentConfig agent,
                                                              List<ConversationMessage> messages,
                                                              int attempt,
                                                              long startedAt,
                                                              FailureKind kind,
                                                              String detail,
                                                              Throwable cause) {
        if (kind.isTransient() && attempt < agent.maxAttempts()) {
            log.warn("[{}] Attempt {}/{} failed: {}. Retrying.",
                    agent.name(), attempt, agent.maxAttempts(), detail);
            return attempt(agent, messages, attempt + 1, startedAt);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        if (kind == FailureKind.UNEXPECTED) {
            log.error("[{}] Request failed after {} attempt(s): {}", agent.name(), attempt, detail, cause);
        } else {
            log.warn("[{}] Request failed after {} attempt(s): {}. elapsed={} ms.",
                    agent.name(), attempt, detail, elapsed.toMillis());
        }
        return CompletableFuture.completedFuture(
                new InvocationOutcome.Failure(agent.name(), kind, detail, elapsed, attempt));
    }

    static FailureKind classify(Throwable error) {
        if (error instanceof TimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (error instanceof ResourceAccessException) {
            return hasTimeoutCause(error) ? FailureKind.TIMEOUT : FailureKind.CONNECTION;
        }
        if (error instanceof RestClientResponseException) {
            return FailureKind.PROTOCOL;
        }
        if (error instanceof MalformedResponseException
                || error instanceof HttpMessageConversionException
                || error instanceof RestClientException) {
            return FailureKind.MALFORMED;
        }
        return FailureKind.UNEXPECTED;
    }

    private static boolean hasTimeoutCause(Throwable error) {
        for (Throwable cause = error.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String describe(FailureKind kind, Throwable error, AgentConfig agent) {
        return switch (kind) {
            case TIMEOUT -> TIMEOUT_DETAIL.formatted(formatTimeout(agent.timeout()));
            case CONNECTION -> CONNECTION_DETAIL.formatted(rootMessage(error));
            case PROTOCOL -> PROTOCOL_DETAIL.formatted(((RestClientResponseException) error).getStatusCode().value());
            case MALFORMED -> MALFORMED_DETAIL.formatted(error.getMessage());
            case UNEXPECTED -> UNEXPECTED_DETAIL.formatted(error.getClass().getSimpleName());
        };
    }

    private static String formatTimeout(Duration timeout) {
        return timeout.toMillis() % 1000 == 0 ? timeout.toSeconds() + "s" : timeout.toMillis() + "ms";
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message != null ? root.getClass().getSimpleName() + " (" + message + ")" : root.getClass().getSimpleName();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Tracks the thread executing one attempt so a timed-out attempt can be interrupted. The
     * interrupt is only delivered while the attempt is inside the endpoint call, and the flag is
     * cleared before the pooled thread is released.
     */
    static final class RunningCall {

        private final CompletableFuture<Void> finished = new CompletableFuture<>();
        private Thread runner;
        private boolean aborted;

        <T> T run(Supplier<T> call) {
            if (!enter()) {
                throw new CancellationException("Attempt was abandoned before it started");
            }
            try {
                return call.get();
            } finally {
                exit();
            }
        }

        private synchronized boolean enter() {
            if (aborted) {
                return false;
            }
            runner = Thread.currentThread();
            return true;
        }

        private synchronized void exit() {
            runner = null;
            Thread.interrupted();
            finished.complete(null);
        }

        /**
         * Interrupts the attempt if it is running and returns a future that completes once it
         * has returned, or after {@code grace} at the latest.
         */
        synchronized CompletableFuture<Void> abort(Duration grace) {
            aborted = true;
            if (runner == null) {
                finished.complete(null);
            } else {
                runner.interrupt();
            }
            return finished.completeOnTimeout(null, grace.toMillis(), TimeUnit.MILLISECONDS);
        }

        synchronized boolean isRunning() {
            return runner != null;
        }
    }
}
