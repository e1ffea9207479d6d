package com.ollamahub.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ollamahub.orchestration.model.AggregatedResponse;
import com.ollamahub.orchestration.model.GenerationMetadata;
import com.ollamahub.orchestration.model.WorkerResult;

import java.time.Duration;
import java.util.List;

public record GenerateResponse(
        @JsonProperty("final_answer") String finalAnswer,
        @JsonProperty("review_comment") String reviewComment,
        @JsonProperty("worker_responses") List<WorkerResponseItem> workerResponses,
        @JsonProperty("metadata") MetadataItem metadata
) {

    static final String WORKER_ERROR_PREFIX = "Error: ";

    public static GenerateResponse from(AggregatedResponse response) {
        return new GenerateResponse(response.finalAnswer(), response.reviewComment(),
                response.workerResults().stream().map(WorkerResponseItem::from).toList(),
                MetadataItem.from(response.metadata()));
    }

    public record WorkerResponseItem(
            @JsonProperty("agent_name") String agentName,
            @JsonProperty("response") String response,
            @JsonProperty("is_success") boolean success,
            @JsonProperty("processing_time") double processingTime
    ) {
        static WorkerResponseItem from(WorkerResult result) {
            String text = result.success() ? result.content() : WORKER_ERROR_PREFIX + result.errorDetail();
            return new WorkerResponseItem(result.agentName(), text, result.success(), seconds(result.elapsed()));
        }
    }

    public record MetadataItem(
            @JsonProperty("total_workers") int totalWorkers,
            @JsonProperty("successful_workers") int successfulWorkers,
            @JsonProperty("failed_workers") int failedWorkers,
            @JsonProperty("processing_time_seconds") double processingTimeSeconds
    ) {
        static MetadataItem from(GenerationMetadata metadata) {
            return new MetadataItem(metadata.totalWorkers(), metadata.successfulWorkers(),
                    metadata.failedWorkers(), seconds(metadata.processingTime()));
        }
    }

    static double seconds(Duration duration) {
        return Math.round(duration.toMillis() / 10.0) / 100.0;
    }
}
