package com.outreachagent.domain.lead.model;

/**
 * Lifecycle of a lead through the outreach pipeline.
 * <p>
 * Status only moves forward along NEW → ENRICHED → COMPOSED → DELIVERED,
 * or diverts from COMPOSED to the terminal FAILED.
 * </p>
 */
public enum LeadStatus {
    NEW,
    ENRICHED,
    COMPOSED,
    DELIVERED,
    FAILED;

    public boolean canTransitionTo(LeadStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case NEW -> next == ENRICHED;
            case ENRICHED -> next == COMPOSED;
            case COMPOSED -> next == DELIVERED || next == FAILED;
            case DELIVERED, FAILED -> false;
        };
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED;
    }
}
