package com.outreachagent.domain.lead.model;

/**
 * A/B email and DM copy produced for one lead before it is persisted as a {@link Message}.
 */
public record MessageDraft(String emailA, String emailB, String dmA, String dmB) {

    public Message toMessage(Long leadId, String cta) {
        return Message.builder()
                .leadId(leadId)
                .emailA(emailA)
                .emailB(emailB)
                .dmA(dmA)
                .dmB(dmB)
                .cta(cta)
                .build();
    }
}
