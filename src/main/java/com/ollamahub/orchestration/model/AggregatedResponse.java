package com.ollamahub.orchestration.model;

import java.util.List;

public record AggregatedResponse(
        String finalAnswer,
        String reviewComment,
        List<WorkerResult> workerResults,
        GenerationMetadata metadata
) {
}
