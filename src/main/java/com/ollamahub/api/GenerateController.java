package com.ollamahub.api;

import com.ollamahub.orchestration.OrchestratorService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Slf4j
public class GenerateController {

    private final OrchestratorService orchestratorService;

    public GenerateController(OrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/generate")
    public GenerateResponse generate(@Valid @RequestBody GenerateRequest request) {
        var conversation = request.toConversation();
        log.info("Generate request received. messages={}, promptLength={}.",
                conversation.size(), conversation.get(conversation.size() - 1).content().length());
        return GenerateResponse.from(orchestratorService.generate(conversation));
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return HealthResponse.ok();
    }
}
