package com.ollamahub.api;

import java.time.Instant;

public record HealthResponse(String status, Instant timestamp) {

    public static HealthResponse ok() {
        return new HealthResponse("ok", Instant.now());
    }
}
