package com.outreachagent.domain.pipeline.model;

import java.util.List;
import java.util.Map;

/**
 * Batch result of one stage execution.
 *
 * @param stage    the stage that produced it
 * @param count    records the stage advanced
 * @param outcomes per-record outcomes, in processing order
 * @param extra    stage-specific counters copied into progress and the stage_completed event
 */
public record StageResult(PipelineStage stage,
                          int count,
                          List<RecordOutcome> outcomes,
                          Map<String, Object> extra) {

    public StageResult {
        outcomes = List.copyOf(outcomes);
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    /**
     * Result whose count is the number of succeeded outcomes.
     */
    public static StageResult of(PipelineStage stage, List<RecordOutcome> outcomes) {
        int succeeded = (int) outcomes.stream()
                .filter(o -> o.kind() == RecordOutcome.Kind.SUCCEEDED)
                .count();
        return new StageResult(stage, succeeded, outcomes, Map.of());
    }

    public StageResult withExtra(Map<String, Object> extra) {
        return new StageResult(stage, count, outcomes, extra);
    }

    public long succeeded() {
        return countOf(RecordOutcome.Kind.SUCCEEDED);
    }

    public long skipped() {
        return countOf(RecordOutcome.Kind.SKIPPED);
    }

    public long failed() {
        return countOf(RecordOutcome.Kind.FAILED);
    }

    public List<RecordOutcome> skippedOutcomes() {
        return outcomes.stream()
                .filter(o -> o.kind() == RecordOutcome.Kind.SKIPPED)
                .toList();
    }

    private long countOf(RecordOutcome.Kind kind) {
        return outcomes.stream().filter(o -> o.kind() == kind).count();
    }
}
