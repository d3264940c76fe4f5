package com.outreachagent.interfaces.api.dto;

import com.outreachagent.domain.pipeline.model.RunConfig;
import jakarta.validation.constraints.Min;

public record StartPipelineRequest(
        Boolean dryRun,

        Boolean aiMode,

        Integer seed,

        @Min(value = 1, message = "count must be at least 1")
        Integer count
) {

    /**
     * Missing flags default to a safe dry run without AI. The upper bound on
     * {@code count} is {@code outreach.pipeline.max-count}, checked by the controller.
     */
    public RunConfig toRunConfig(int defaultCount) {
        return new RunConfig(
                dryRun == null || dryRun,
                aiMode != null && aiMode,
                seed,
                count == null ? defaultCount : count);
    }
}
