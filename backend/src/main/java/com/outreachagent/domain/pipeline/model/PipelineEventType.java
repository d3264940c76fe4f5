package com.outreachagent.domain.pipeline.model;

public enum PipelineEventType {
    INIT("init"),
    PIPELINE_STARTED("pipeline_started"),
    STAGE_STARTED("stage_started"),
    STAGE_COMPLETED("stage_completed"),
    METRICS_UPDATE("metrics_update"),
    PIPELINE_STOPPING("pipeline_stopping"),
    PIPELINE_STOPPED("pipeline_stopped"),
    PIPELINE_COMPLETED("pipeline_completed"),
    PIPELINE_ERROR("pipeline_error");

    private final String wireName;

    PipelineEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
