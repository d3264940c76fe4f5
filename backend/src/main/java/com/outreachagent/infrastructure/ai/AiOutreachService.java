package com.outreachagent.infrastructure.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.outreachagent.domain.lead.model.EnrichmentProfile;
import com.outreachagent.domain.lead.model.Lead;
import com.outreachagent.domain.lead.model.MessageDraft;
import com.outreachagent.infrastructure.stage.MessageTemplates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * AI-backed enrichment and message writing. Callers own the fallback path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiOutreachService {

    private static final double ENRICHMENT_TEMPERATURE = 0.3;
    private static final int ENRICHMENT_MAX_TOKENS = 300;
    private static final double MESSAGE_TEMPERATURE = 0.7;
    private static final int MESSAGE_MAX_TOKENS = 800;

    private final LlmClient llmClient;
    private final OutreachPromptBuilder promptBuilder;

    public EnrichmentProfile enrich(Lead lead) {
        log.info("[AI] Enriching lead {} ({})", lead.getFullName(), lead.getCompany());
        JsonNode node = llmClient.completeJson(
                promptBuilder.getEnrichmentSystemPrompt(),
                promptBuilder.buildEnrichmentUserMessage(lead),
                ENRICHMENT_TEMPERATURE, ENRICHMENT_MAX_TOKENS);

        EnrichmentProfile profile = new EnrichmentProfile(
                textOrNull(node, "company_size"),
                textOrNull(node, "persona"),
                stringList(node.get("pains")),
                stringList(node.get("triggers")),
                confidence(node.get("confidence")));
        log.info("[AI] Enriched: companySize={}, confidence={}", profile.companySize(), profile.confidence());
        return profile;
    }

    public MessageDraft compose(Lead lead) {
        log.info("[AI] Generating messages for {} ({})", lead.getFullName(), lead.getCompany());
        JsonNode node = llmClient.completeJson(
                promptBuilder.getMessageSystemPrompt(),
                promptBuilder.buildMessageUserMessage(lead),
                MESSAGE_TEMPERATURE, MESSAGE_MAX_TOKENS);

        return new MessageDraft(
                clean(node.get("email_a"), MessageTemplates.EMAIL_MAX_WORDS),
                clean(node.get("email_b"), MessageTemplates.EMAIL_MAX_WORDS),
                clean(node.get("dm_a"), MessageTemplates.DM_MAX_WORDS),
                clean(node.get("dm_b"), MessageTemplates.DM_MAX_WORDS));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> stringList(JsonNode value) {
        List<String> items = new ArrayList<>();
        if (value == null || value.isNull()) {
            return items;
        }
        if (value.isArray()) {
            value.forEach(item -> items.add(item.asText()));
        } else {
            for (String part : value.asText().split(";")) {
                if (!part.isBlank()) {
                    items.add(part.strip());
                }
            }
        }
        return items;
    }

    private static double confidence(JsonNode value) {
        if (value == null || value.isNull()) {
            return 0.0;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.parseDouble(value.asText().strip());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    /**
     * Messages sometimes come back nested ({"body": ...}) or with escaped newlines.
     */
    private static String clean(JsonNode value, int maxWords) {
        if (value == null || value.isNull()) {
            return "";
        }
        String text;
        if (value.isObject()) {
            text = value.toString();
            for (String key : List.of("body", "text", "content", "message")) {
                if (value.has(key)) {
                    text = value.get(key).asText();
                    break;
                }
            }
        } else {
            text = value.asText();
        }
        text = text.replace("\\n", "\n").replace("\\r", "").replace("\\t", " ");
        return MessageTemplates.truncateToWordLimit(text, maxWords);
    }
}
