package com.outreachagent.domain.pipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only copy of the in-memory pipeline progress. Never persisted.
 */
public record PipelineSnapshot(PipelineState state,
                               boolean running,
                               PipelineStage currentStage,
                               boolean shouldStop,
                               Long runId,
                               Map<String, StageProgress> progress) {

    public PipelineSnapshot {
        progress = Collections.unmodifiableMap(new LinkedHashMap<>(progress));
    }

    public static PipelineSnapshot idle() {
        return new PipelineSnapshot(PipelineState.IDLE, false, null, false, null, pendingProgress());
    }

    public static Map<String, StageProgress> pendingProgress() {
        Map<String, StageProgress> progress = new LinkedHashMap<>();
        for (PipelineStage stage : PipelineStage.values()) {
            progress.put(stage.wireName(), StageProgress.pending());
        }
        return progress;
    }

    public StageProgress progressOf(PipelineStage stage) {
        return progress.get(stage.wireName());
    }
}
