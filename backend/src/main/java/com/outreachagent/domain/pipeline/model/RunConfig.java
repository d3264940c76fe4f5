package com.outreachagent.domain.pipeline.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record RunConfig(boolean dryRun, boolean aiMode, Integer seed, int count) {

    public RunConfig {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1");
        }
    }

    public Map<String, Object> toEventData() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("dryRun", dryRun);
        m.put("aiMode", aiMode);
        m.put("seed", seed);
        m.put("count", count);
        return m;
    }
}
