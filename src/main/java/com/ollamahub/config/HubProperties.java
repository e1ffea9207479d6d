package com.ollamahub.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ollamahub")
public class HubProperties {

    private AgentSettings reviewerAgent;
    private List<AgentSettings> workerAgents = new ArrayList<>();
    private SystemSettings systemSettings = new SystemSettings();
    private HttpSettings http = new HttpSettings();

    /**
     * One agent entry as written in configuration. Missing timeout and retry values fall back to
     * {@link SystemSettings}.
     */
    public static class AgentSettings {
        private String name;
        private String apiUrl;
        private String model;
        private Integer timeout;
        private Integer maxRetries;
        private String description;

        public AgentSettings() {}

        public AgentSettings(String name, String apiUrl, String model) {
            this.name = name;
            this.apiUrl = apiUrl;
            this.model = model;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        /** Timeout in seconds. */
        public Integer getTimeout() { return timeout; }
        public void setTimeout(Integer timeout) { this.timeout = timeout; }
        public Integer getMaxRetries() { return maxRetries; }
        public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
    }

    public static class SystemSettings {
        private int maxRetries = 1;
        private int defaultTimeout = 60;
        private boolean stream = false;
        private String logLevel = "INFO";

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        /** Default timeout in seconds. */
        public int getDefaultTimeout() { return defaultTimeout; }
        public void setDefaultTimeout(int defaultTimeout) { this.defaultTimeout = defaultTimeout; }
        public boolean isStream() { return stream; }
        public void setStream(boolean stream) { this.stream = stream; }
        public String getLogLevel() { return logLevel; }
        public void setLogLevel(String logLevel) { this.logLevel = logLevel; }
    }

    public static class HttpSettings {
        private Duration connectTimeout = Duration.ofSeconds(10);

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    }

    public AgentSettings getReviewerAgent() {
        return reviewerAgent;
    }

    public void setReviewerAgent(AgentSettings reviewerAgent) {
        this.reviewerAgent = reviewerAgent;
    }

    public List<AgentSettings> getWorkerAgents() {
        return workerAgents;
    }

    public void setWorkerAgents(List<AgentSettings> workerAgents) {
        if (workerAgents == null) {
            return;
        }
        this.workerAgents = new ArrayList<>(workerAgents);
    }

    public SystemSettings getSystemSettings() {
        return systemSettings;
    }

    public void setSystemSettings(SystemSettings systemSettings) {
        this.systemSettings = systemSettings != null ? systemSettings : new SystemSettings();
    }

    public HttpSettings getHttp() {
        return http;
    }

    public void setHttp(HttpSettings http) {
        this.http = http != null ? http : new HttpSettings();
    }
}
