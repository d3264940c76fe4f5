package com.outreachagent.application.lead.exception;

public class LeadNotFoundException extends RuntimeException {
    public LeadNotFoundException(Long leadId) {
        super("Lead not found: " + leadId);
    }
}
