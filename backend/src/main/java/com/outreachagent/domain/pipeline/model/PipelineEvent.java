package com.outreachagent.domain.pipeline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lifecycle event fanned out to observers. Immutable once constructed.
 */
public record PipelineEvent(String type, Map<String, Object> data, Instant timestamp) {

    public PipelineEvent {
        // LinkedHashMap copy keeps insertion order and tolerates null values (e.g. seed)
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static PipelineEvent of(PipelineEventType type, Map<String, Object> data) {
        return new PipelineEvent(type.wireName(), data, Instant.now());
    }

    public boolean is(PipelineEventType type) {
        return type.wireName().equals(this.type);
    }
}
