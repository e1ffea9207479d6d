package com.ollamahub.orchestration.model;

import java.time.Duration;

public record GenerationMetadata(
        Duration processingTime,
        int totalWorkers,
        int successfulWorkers,
        int failedWorkers
) {
}
