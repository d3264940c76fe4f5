package com.outreachagent.domain.pipeline.model;

/**
 * Parameters handed to a stage handler for one run.
 */
public record StageContext(Long runId, RunConfig config) {
}
