package com.outreachagent.domain.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline stages in execution order.
 */
public enum PipelineStage {
    GENERATE("generate", false),
    ENRICH("enrich", true),
    COMPOSE("compose", false),
    DELIVER("deliver", true);

    private final String wireName;
    private final boolean reportsMetrics;

    PipelineStage(String wireName, boolean reportsMetrics) {
        this.wireName = wireName;
        this.reportsMetrics = reportsMetrics;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Whether a store-wide status tally is broadcast after this stage completes.
     */
    public boolean reportsMetrics() {
        return reportsMetrics;
    }
}
