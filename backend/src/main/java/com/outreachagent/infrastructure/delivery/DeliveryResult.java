package com.outreachagent.infrastructure.delivery;

import com.outreachagent.domain.pipeline.model.RecordOutcome;

/**
 * Result of guarding one lead's delivery.
 *
 * @param attempts send attempts made (0 when skipped)
 * @param error    last error description, or the skip reason
 */
public record DeliveryResult(Long leadId, Status status, int attempts, String error) {

    public enum Status {
        DELIVERED,
        FAILED,
        SKIPPED
    }

    public RecordOutcome toRecordOutcome() {
        return switch (status) {
            case DELIVERED -> RecordOutcome.succeeded(leadId);
            case FAILED -> RecordOutcome.failed(leadId, error);
            case SKIPPED -> RecordOutcome.skipped(leadId, error);
        };
    }
}
