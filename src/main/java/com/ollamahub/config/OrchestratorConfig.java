package com.ollamahub.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OrchestratorConfig {

    // Cached pool: simultaneous outbound agent calls are not capped.
    @Bean(destroyMethod = "shutdown")
    public ExecutorService workerExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("agent-call-"));
    }
}
