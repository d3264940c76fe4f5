package com.outreachagent.infrastructure.ai;

import com.outreachagent.domain.lead.model.Lead;
import org.springframework.stereotype.Component;

/**
 * Builds the system and user prompts for AI enrichment and AI message composition.
 */
@Component
public class OutreachPromptBuilder {

    private static final String ENRICHMENT_SYSTEM_PROMPT = """
            You are a B2B lead enrichment assistant. Analyze the lead and return ONLY a valid JSON object \
            (no markdown, no explanation) with these exact keys:
            - company_size: one of 'SMB', 'Mid-Market', or 'Enterprise'
            - persona: a brief description of their role/persona
            - pains: an array of 2 pain points relevant to their role
            - triggers: an array of 1-2 buying triggers
            - confidence: a number from 0-100 representing confidence in the enrichment
            Example: {"company_size": "Mid-Market", "persona": "Tech Leader", \
            "pains": ["scaling challenges", "talent retention"], "triggers": ["recent funding"], "confidence": 75}""";

    private static final String MESSAGE_SYSTEM_PROMPT = """
            You are an expert B2B sales copywriter. Generate highly personalized outreach messages.
            Return ONLY a valid JSON object (no markdown, no explanation) with these exact keys:
            - email_a: A pain-focused email (max 120 words). Empathize with their challenges.
            - email_b: A trigger/opportunity-focused email (max 120 words). Highlight timing and opportunity.
            - dm_a: A brief LinkedIn DM (max 60 words). Pain-focused, conversational.
            - dm_b: A brief LinkedIn DM (max 60 words). Opportunity-focused, forward-looking.

            Each message MUST:
            1. Use their first name
            2. Reference their specific company and role
            3. Mention specific pain points or triggers relevant to THEM
            4. Sound natural and human, not salesy
            5. End with a clear CTA for a 15-minute call

            Make each variant genuinely different in tone and approach, not just word swaps.""";

    public String getEnrichmentSystemPrompt() {
        return ENRICHMENT_SYSTEM_PROMPT;
    }

    public String getMessageSystemPrompt() {
        return MESSAGE_SYSTEM_PROMPT;
    }

    public String buildEnrichmentUserMessage(Lead lead) {
        return "Enrich this B2B lead:\n"
                + "- Name: " + lead.getFullName() + "\n"
                + "- Title: " + lead.getTitle() + "\n"
                + "- Company: " + lead.getCompany() + "\n"
                + "- Industry: " + lead.getIndustry() + "\n"
                + "- Country: " + lead.getCountry();
    }

    public String buildMessageUserMessage(Lead lead) {
        StringBuilder sb = new StringBuilder();
        sb.append("Generate personalized outreach messages for this lead:\n\n");
        sb.append("Name: ").append(lead.getFullName()).append('\n');
        sb.append("Title: ").append(lead.getTitle()).append('\n');
        sb.append("Company: ").append(lead.getCompany()).append('\n');
        sb.append("Industry: ").append(lead.getIndustry()).append('\n');
        sb.append("Country: ").append(lead.getCountry()).append('\n');
        sb.append("Company Size: ").append(orDefault(lead.getCompanySize(), "Unknown")).append('\n');
        sb.append("Persona: ").append(orDefault(lead.getPersona(), "Business Leader")).append('\n');
        sb.append("Pain Points: ").append(orDefault(lead.getPains(), "Operational challenges")).append('\n');
        sb.append("Buying Triggers: ").append(orDefault(lead.getTriggers(), "Growth initiatives")).append("\n\n");
        sb.append("Write 4 unique, compelling messages that would make ")
                .append(lead.getFirstName())
                .append(" want to respond.");
        return sb.toString();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
