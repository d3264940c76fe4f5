package com.outreachagent.domain.pipeline.model;

import java.util.Map;

/**
 * Progress of one stage inside a {@link PipelineSnapshot}.
 *
 * @param status pending, running or completed
 * @param count  records the stage produced
 * @param extra  stage-specific counters (e.g. sent/failed for deliver)
 */
public record StageProgress(String status, int count, Map<String, Object> extra) {

    public static final String PENDING = "pending";
    public static final String RUNNING = "running";
    public static final String COMPLETED = "completed";

    public StageProgress {
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public static StageProgress pending() {
        return new StageProgress(PENDING, 0, Map.of());
    }

    public StageProgress running() {
        return new StageProgress(RUNNING, count, extra);
    }

    public StageProgress completed(int count, Map<String, Object> extra) {
        return new StageProgress(COMPLETED, count, extra);
    }
}
