package com.ollamahub.orchestration.service;

import com.ollamahub.orchestration.model.AggregatedResponse;
import com.ollamahub.orchestration.model.ReviewOutcome;
import com.ollamahub.orchestration.model.WorkerDispatch;
import com.ollamahub.orchestration.model.WorkerResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultComposerTest {

    private final ResultComposer composer = new ResultComposer();

    @Test
    void testMetadataIsConsistentWithResults() {
        WorkerDispatch dispatch = new WorkerDispatch(List.of(
                WorkerResult.succeeded("Worker A", "x", Duration.ofSeconds(2)),
                WorkerResult.failed("Worker B", "Timed out after 5s", Duration.ofSeconds(5)),
                WorkerResult.succeeded("Worker C", "y", Duration.ofSeconds(3))));

        AggregatedResponse response = composer.compose(dispatch, new ReviewOutcome("critique", "answer"),
                Duration.ofMillis(6500));

        assertEquals("answer", response.finalAnswer());
        assertEquals("critique", response.reviewComment());
        assertEquals(3, response.metadata().totalWorkers());
        assertEquals(2, response.metadata().successfulWorkers());
        assertEquals(1, response.metadata().failedWorkers());
        assertEquals(response.workerResults().size(),
                response.metadata().successfulWorkers() + response.metadata().failedWorkers());
        assertEquals(Duration.ofMillis(6500), response.metadata().processingTime());
        assertEquals(dispatch.results(), response.workerResults());
    }
}
