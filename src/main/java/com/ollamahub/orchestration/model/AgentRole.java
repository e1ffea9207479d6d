package com.ollamahub.orchestration.model;

public enum AgentRole {
    WORKER,
    REVIEWER
}
