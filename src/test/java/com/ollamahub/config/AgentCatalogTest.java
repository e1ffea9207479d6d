package com.ollamahub.config;

import com.ollamahub.orchestration.model.AgentConfig;
import com.ollamahub.orchestration.model.AgentRole;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentCatalogTest {

    private static HubProperties validProperties() {
        HubProperties properties = new HubProperties();
        properties.setReviewerAgent(new HubProperties.AgentSettings("Reviewer", "http://localhost:11434/api/chat", "big"));
        properties.setWorkerAgents(List.of(
                new HubProperties.AgentSettings("Worker A", "http://localhost:11434/api/chat", "small-a"),
                new HubProperties.AgentSettings("Worker B", "http://localhost:11435/api/chat", "small-b")));
        return properties;
    }

    @Test
    void testLoadsWorkersInConfiguredOrder() {
        AgentCatalog catalog = new AgentCatalog(validProperties());

        assertEquals(List.of("Worker A", "Worker B"), catalog.workers().stream().map(AgentConfig::name).toList());
        assertTrue(catalog.workers().stream().allMatch(worker -> worker.role() == AgentRole.WORKER));
        assertEquals(AgentRole.REVIEWER, catalog.reviewer().role());
    }

    @Test
    void testStripsChatPathFromApiUrl() {
        AgentCatalog catalog = new AgentCatalog(validProperties());

        assertEquals("http://localhost:11434", catalog.reviewer().baseUrl());
        assertEquals("http://localhost:11435", catalog.workers().get(1).baseUrl());
    }

    @Test
    void testAcceptsServerRootAsApiUrl() {
        assertEquals("https://ollama.example.com",
                AgentCatalog.normalizeBaseUrl("agent", "https://ollama.example.com/"));
    }

    @Test
    void testAppliesSystemDefaults() {
        HubProperties properties = validProperties();
        properties.getSystemSettings().setDefaultTimeout(42);
        properties.getSystemSettings().setMaxRetries(3);
        properties.getWorkerAgents().get(1).setTimeout(7);
        properties.getWorkerAgents().get(1).setMaxRetries(0);

        AgentCatalog catalog = new AgentCatalog(properties);

        assertEquals(Duration.ofSeconds(42), catalog.workers().get(0).timeout());
        assertEquals(3, catalog.workers().get(0).maxRetries());
        assertEquals(Duration.ofSeconds(7), catalog.workers().get(1).timeout());
        assertEquals(0, catalog.workers().get(1).maxRetries());
    }

    @Test
    void testRejectsNonHttpUrl() {
        HubProperties properties = validProperties();
        properties.getWorkerAgents().get(0).setApiUrl("ftp://localhost/api/chat");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> new AgentCatalog(properties));
        assertTrue(ex.getMessage().contains("worker-agents[0].api-url"));
    }

    @Test
    void testRejectsTimeoutOutOfRange() {
        HubProperties tooShort = validProperties();
        tooShort.getWorkerAgents().get(0).setTimeout(0);
        assertThrows(IllegalStateException.class, () -> new AgentCatalog(tooShort));

        HubProperties tooLong = validProperties();
        tooLong.getReviewerAgent().setTimeout(AgentCatalog.MAX_TIMEOUT_SECONDS + 1);
        assertThrows(IllegalStateException.class, () -> new AgentCatalog(tooLong));
    }

    @Test
    void testRequiresAtLeastOneWorker() {
        HubProperties properties = validProperties();
        properties.setWorkerAgents(List.of());

        assertThrows(IllegalStateException.class, () -> new AgentCatalog(properties));
    }

    @Test
    void testRequiresReviewer() {
        HubProperties properties = validProperties();
        properties.setReviewerAgent(null);

        assertThrows(IllegalStateException.class, () -> new AgentCatalog(properties));
    }
}
