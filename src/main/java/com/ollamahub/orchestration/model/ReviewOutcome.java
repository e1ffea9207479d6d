package com.ollamahub.orchestration.model;

public record ReviewOutcome(String reviewComment, String finalAnswer) {
}
