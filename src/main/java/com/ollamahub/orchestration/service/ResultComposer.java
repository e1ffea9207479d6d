package com.ollamahub.orchestration.service;

import com.ollamahub.orchestration.model.AggregatedResponse;
import com.ollamahub.orchestration.model.GenerationMetadata;
import com.ollamahub.orchestration.model.ReviewOutcome;
import com.ollamahub.orchestration.model.WorkerDispatch;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class ResultComposer {

    /**
     * @param processingTime wall time of the whole pipeline, fan-out and review included
     */
    public AggregatedResponse compose(WorkerDispatch dispatch, ReviewOutcome review, Duration processingTime) {
        GenerationMetadata metadata = new GenerationMetadata(processingTime,
                dispatch.totalWorkers(), dispatch.successfulWorkers(), dispatch.failedWorkers());
        return new AggregatedResponse(review.finalAnswer(), review.reviewComment(), dispatch.results(), metadata);
    }
}
