package com.ollamahub.config;

import com.ollamahub.orchestration.model.AgentConfig;
import com.ollamahub.orchestration.model.AgentRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validated, immutable view of the configured agents. Built once at startup; an invalid
 * configuration fails the context.
 */
@Component
@Slf4j
public class AgentCatalog {

    static final int MIN_TIMEOUT_SECONDS = 1;
    static final int MAX_TIMEOUT_SECONDS = 600;
    private static final String CHAT_PATH = "/api/chat";

    private final AgentConfig reviewer;
    private final List<AgentConfig> workers;

    public AgentCatalog(HubProperties properties) {
        HubProperties.SystemSettings defaults = properties.getSystemSettings();
        if (defaults.getMaxRetries() < 0) {
            throw new IllegalStateException("ollamahub.system-settings.max-retries must not be negative");
        }
        requireTimeoutInRange("ollamahub.system-settings.default-timeout", defaults.getDefaultTimeout());
        if (properties.getReviewerAgent() == null) {
            throw new IllegalStateException("ollamahub.reviewer-agent must be configured");
        }
        if (properties.getWorkerAgents().isEmpty()) {
            throw new IllegalStateException("At least one entry in ollamahub.worker-agents is required");
        }
        this.reviewer = toAgentConfig("ollamahub.reviewer-agent", properties.getReviewerAgent(), AgentRole.REVIEWER, defaults);
        List<AgentConfig> resolved = new ArrayList<>();
        for (int i = 0; i < properties.getWorkerAgents().size(); i++) {
            resolved.add(toAgentConfig("ollamahub.worker-agents[" + i + "]", properties.getWorkerAgents().get(i),
                    AgentRole.WORKER, defaults));
        }
        this.workers = List.copyOf(resolved);
        log.info("Agent configuration loaded. workers={}, reviewer={}.", workers.size(), reviewer.name());
    }

    public AgentConfig reviewer() {
        return reviewer;
    }

    /** Workers in configured order. */
    public List<AgentConfig> workers() {
        return workers;
    }

    private static AgentConfig toAgentConfig(String path, HubProperties.AgentSettings settings, AgentRole role,
                                             HubProperties.SystemSettings defaults) {
        if (settings == null) {
            throw new IllegalStateException(path + " must not be empty");
        }
        if (!StringUtils.hasText(settings.getName())) {
            throw new IllegalStateException(path + ".name is required");
        }
        if (!StringUtils.hasText(settings.getModel())) {
            throw new IllegalStateException(path + ".model is required");
        }
        int timeout = settings.getTimeout() != null ? settings.getTimeout() : defaults.getDefaultTimeout();
        requireTimeoutInRange(path + ".timeout", timeout);
        int maxRetries = settings.getMaxRetries() != null ? settings.getMaxRetries() : defaults.getMaxRetries();
        if (maxRetries < 0) {
            throw new IllegalStateException(path + ".max-retries must not be negative");
        }
        return new AgentConfig(settings.getName().trim(), normalizeBaseUrl(path, settings.getApiUrl()),
                settings.getModel().trim(), Duration.ofSeconds(timeout), maxRetries, role, settings.getDescription());
    }

    static String normalizeBaseUrl(String path, String apiUrl) {
        if (!StringUtils.hasText(apiUrl)) {
            throw new IllegalStateException(path + ".api-url is required");
        }
        String url = apiUrl.trim();
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            throw new IllegalStateException(path + ".api-url must start with http:// or https://");
        }
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        if (url.endsWith(CHAT_PATH)) {
            return url.substring(0, url.length() - CHAT_PATH.length());
        }
        log.warn("{}.api-url '{}' does not end with {}. Using it as the server root.", path, apiUrl, CHAT_PATH);
        return url;
    }

    private static void requireTimeoutInRange(String path, int seconds) {
        if (seconds < MIN_TIMEOUT_SECONDS || seconds > MAX_TIMEOUT_SECONDS) {
            throw new IllegalStateException("%s must be between %d and %d seconds, was %d"
                    .formatted(path, MIN_TIMEOUT_SECONDS, MAX_TIMEOUT_SECONDS, seconds));
        }
    }
}
