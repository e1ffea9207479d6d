package com.ollamahub.orchestration.model;

import org.springframework.lang.Nullable;
import org.springframework.util.Assert;

import java.time.Duration;

/**
 * Immutable description of one model endpoint. Instances are built once at startup and shared
 * by reference across concurrently handled requests.
 *
 * @param name display name, also used to attribute answers in the review prompt
 * @param baseUrl root URL of the Ollama server, without the {@code /api/chat} suffix
 * @param model model identifier sent with every request
 * @param timeout bound applied to each round trip
 * @param maxRetries additional attempts allowed after a transient failure
 * @param role whether the agent answers the prompt or reviews the answers
 * @param description optional free text shown in the agent listing
 */
public record AgentConfig(
        String name,
        String baseUrl,
        String model,
        Duration timeout,
        int maxRetries,
        AgentRole role,
        @Nullable String description
) {

    public AgentConfig {
        Assert.hasText(name, "Agent name must not be empty");
        Assert.hasText(baseUrl, "Agent base URL must not be empty");
        Assert.hasText(model, "Agent model must not be empty");
        Assert.notNull(timeout, "Agent timeout must not be null");
        Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "Agent timeout must be positive");
        Assert.isTrue(maxRetries >= 0, "Agent max retries must not be negative");
        Assert.notNull(role, "Agent role must not be null");
    }

    public static AgentConfig worker(String name, String baseUrl, String model, Duration timeout, int maxRetries) {
        return new AgentConfig(name, baseUrl, model, timeout, maxRetries, AgentRole.WORKER, null);
    }

    public static AgentConfig reviewer(String name, String baseUrl, String model, Duration timeout, int maxRetries) {
        return new AgentConfig(name, baseUrl, model, timeout, maxRetries, AgentRole.REVIEWER, null);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
