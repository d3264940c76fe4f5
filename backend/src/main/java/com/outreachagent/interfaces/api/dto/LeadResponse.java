package com.outreachagent.interfaces.api.dto;

import com.outreachagent.domain.lead.model.Lead;

public record LeadResponse(
        Long id,
        String name,
        String company,
        String title,
        String industry,
        String email,
        String linkedin,
        String country,
        String status,
        String companySize,
        String persona,
        Double confidence,
        String pains,
        String triggers,
        String lastError
) {

    public static LeadResponse from(Lead lead) {
        return new LeadResponse(
                lead.getId(),
                lead.getFullName(),
                lead.getCompany(),
                lead.getTitle(),
                lead.getIndustry(),
                lead.getEmail(),
                lead.getLinkedin(),
                lead.getCountry(),
                lead.getStatus().name(),
                lead.getCompanySize(),
                lead.getPersona(),
                lead.getConfidence(),
                lead.getPains(),
                lead.getTriggers(),
                lead.getLastError());
    }
}
