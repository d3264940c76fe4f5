package com.outreachagent.domain.pipeline.model;

/**
 * Per-record result of a stage. SKIPPED records keep their status and the reason.
 */
public record RecordOutcome(Long leadId, Kind kind, String reason) {

    public enum Kind {
        SUCCEEDED,
        SKIPPED,
        FAILED
    }

    public static RecordOutcome succeeded(Long leadId) {
        return new RecordOutcome(leadId, Kind.SUCCEEDED, null);
    }

    public static RecordOutcome skipped(Long leadId, String reason) {
        return new RecordOutcome(leadId, Kind.SKIPPED, reason);
    }

    public static RecordOutcome failed(Long leadId, String reason) {
        return new RecordOutcome(leadId, Kind.FAILED, reason);
    }
}
