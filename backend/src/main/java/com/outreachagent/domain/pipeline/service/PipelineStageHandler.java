package com.outreachagent.domain.pipeline.service;

import com.outreachagent.domain.pipeline.model.PipelineStage;
import com.outreachagent.domain.pipeline.model.StageContext;
import com.outreachagent.domain.pipeline.model.StageResult;

/**
 * One pluggable pipeline stage.
 * <p>
 * Implementations commit their own writes before returning and advance
 * per-record status themselves. Per-record failures they do not isolate
 * must be thrown; the orchestrator treats any escaping exception as fatal
 * to the whole run.
 * </p>
 */
public interface PipelineStageHandler {

    PipelineStage stage();

    StageResult execute(StageContext context);
}
