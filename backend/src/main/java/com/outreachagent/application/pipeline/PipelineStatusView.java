package com.outreachagent.application.pipeline;

import com.outreachagent.domain.pipeline.model.PipelineSnapshot;

public record PipelineStatusView(PipelineSnapshot pipelineState, PipelineMetrics metrics) {
}
