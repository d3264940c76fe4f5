package com.outreachagent.infrastructure.stage;

import com.outreachagent.domain.lead.model.Lead;
import com.outreachagent.domain.lead.model.MessageDraft;

import java.util.Arrays;

/**
 * Template copy used when AI composition is off or fails.
 */
public final class MessageTemplates {

    public static final String CTA = "Would you be open to a 15-minute call next week?";
    public static final int EMAIL_MAX_WORDS = 120;
    public static final int DM_MAX_WORDS = 60;

    private MessageTemplates() {
    }

    public static MessageDraft draftFor(Lead lead) {
        return new MessageDraft(emailVariantA(lead), emailVariantB(lead), dmVariantA(lead), dmVariantB(lead));
    }

    /**
     * Keeps the first {@code maxWords} whitespace-separated words. A cut that does not
     * end a sentence gets a trailing ellipsis.
     */
    public static String truncateToWordLimit(String text, int maxWords) {
        if (text == null) {
            return "";
        }
        String[] words = text.trim().split("\\s+");
        if (text.isBlank() || words.length <= maxWords) {
            return text;
        }
        String truncated = String.join(" ", Arrays.copyOf(words, maxWords));
        if (truncated.endsWith(".") || truncated.endsWith("!") || truncated.endsWith("?")) {
            return truncated;
        }
        return truncated.replaceAll("[,;:]+$", "") + "...";
    }

    // Pain-led email.
    static String emailVariantA(Lead lead) {
        String pains = orDefault(lead.getPains(), "operational friction");
        String persona = orDefault(lead.getPersona(), "teams");
        String email = "Hi " + lead.getFirstName() + ",\n\n"
                + "I noticed your role at " + lead.getCompany() + " in " + lead.getIndustry() + ". "
                + "Many " + persona + " leaders I work with face similar challenges: " + pains + ". "
                + "I've helped teams reduce these friction points significantly.\n\n"
                + CTA + "\n\n"
                + "Best regards";
        return truncateToWordLimit(email, EMAIL_MAX_WORDS);
    }

    // Trigger-led email.
    static String emailVariantB(Lead lead) {
        String triggers = orDefault(lead.getTriggers(), "upcoming initiatives");
        String email = "Hi " + lead.getFirstName() + ",\n\n"
                + "With " + triggers + " happening in " + lead.getIndustry() + ", teams like yours at "
                + lead.getCompany() + " often see this as the right moment to optimize operations. "
                + "I'd love to share a quick framework that's helped similar organizations.\n\n"
                + CTA + "\n\n"
                + "Cheers";
        return truncateToWordLimit(email, EMAIL_MAX_WORDS);
    }

    static String dmVariantA(Lead lead) {
        String pain = firstItem(lead.getPains(), "common challenges");
        String dm = "Hi " + lead.getFirstName() + ", noticed your work at " + lead.getCompany() + ". "
                + "Many in similar roles tackle " + pain + ". "
                + "Happy to share a 10-min teardown if useful. " + CTA;
        return truncateToWordLimit(dm, DM_MAX_WORDS);
    }

    static String dmVariantB(Lead lead) {
        String trigger = firstItem(lead.getTriggers(), "growth phase");
        String dm = "Hi " + lead.getFirstName() + ", saw your profile and " + lead.getCompany() + "'s momentum. "
                + "With " + trigger + ", now could be ideal timing to streamline operations. "
                + "Quick call? " + CTA;
        return truncateToWordLimit(dm, DM_MAX_WORDS);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String firstItem(String joined, String fallback) {
        String value = orDefault(joined, fallback);
        return value.split(";")[0].strip();
    }
}
