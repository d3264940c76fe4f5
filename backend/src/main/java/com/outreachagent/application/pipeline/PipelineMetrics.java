package com.outreachagent.application.pipeline;

import java.util.Map;

public record PipelineMetrics(long total, Map<String, Long> statusCounts) {

    public static PipelineMetrics from(Map<String, Long> statusCounts) {
        long total = statusCounts.values().stream().mapToLong(Long::longValue).sum();
        return new PipelineMetrics(total, statusCounts);
    }

    public long count(String status) {
        return statusCounts.getOrDefault(status, 0L);
    }

    public Map<String, Object> toEventData() {
        return Map.of("total", total, "statusCounts", statusCounts);
    }
}
