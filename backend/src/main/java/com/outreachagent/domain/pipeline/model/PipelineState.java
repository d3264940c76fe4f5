package com.outreachagent.domain.pipeline.model;

public enum PipelineState {
    IDLE,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == STOPPED || this == COMPLETED || this == ERROR;
    }

    public boolean isActive() {
        return this == STARTING || this == RUNNING || this == STOPPING;
    }
}
