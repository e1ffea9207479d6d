package com.ollamahub.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ollamahub.config.AgentCatalog;
import com.ollamahub.orchestration.model.AgentConfig;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class AgentsController {

    private static final String CHAT_PATH = "/api/chat";

    private final AgentCatalog agentCatalog;

    public AgentsController(AgentCatalog agentCatalog) {
        this.agentCatalog = agentCatalog;
    }

    @GetMapping("/agents")
    public AgentsResponse getAgents() {
        return new AgentsResponse(
                AgentSummary.from(agentCatalog.reviewer()),
                agentCatalog.workers().stream().map(AgentSummary::from).toList()
        );
    }

    public record AgentsResponse(
            AgentSummary reviewer,
            List<AgentSummary> workers
    ) {}

    public record AgentSummary(
            String name,
            String model,
            @JsonProperty("api_url") String apiUrl,
            String description
    ) {
        static AgentSummary from(AgentConfig agent) {
            return new AgentSummary(agent.name(), agent.model(), agent.baseUrl() + CHAT_PATH, agent.description());
        }
    }
}
