package com.outreachagent.domain.lead.model;

import java.util.List;

/**
 * Firmographic and persona data attached to a lead by the enrich stage.
 */
public record EnrichmentProfile(String companySize,
                                String persona,
                                List<String> pains,
                                List<String> triggers,
                                double confidence) {

    public EnrichmentProfile {
        pains = pains == null ? List.of() : List.copyOf(pains);
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
    }

    public void applyTo(Lead lead) {
        lead.applyEnrichment(companySize, persona, String.join("; ", pains), String.join("; ", triggers), confidence);
    }
}
