package com.outreachagent.infrastructure.stage;

import com.outreachagent.application.tracking.RunRecorder;
import com.outreachagent.domain.lead.model.EnrichmentProfile;
import com.outreachagent.domain.lead.model.Lead;
import com.outreachagent.domain.lead.model.LeadStatus;
import com.outreachagent.domain.lead.repository.LeadRepository;
import com.outreachagent.domain.pipeline.model.PipelineStage;
import com.outreachagent.domain.pipeline.model.RecordOutcome;
import com.outreachagent.domain.pipeline.model.StageContext;
import com.outreachagent.domain.pipeline.model.StageResult;
import com.outreachagent.domain.pipeline.service.PipelineStageHandler;
import com.outreachagent.infrastructure.ai.AiOutreachService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Enriches every NEW lead and advances it to ENRICHED.
 * <p>
 * AI mode falls back to the rule-based heuristics whenever the AI call fails,
 * so a lead never stalls in NEW because of the optional enrichment source.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LeadEnricher implements PipelineStageHandler {

    private static final List<String> C_SUITE_MARKERS = List.of("cto", "ceo", "cfo", "coo", "vp", "chief");
    private static final List<String> DIRECTOR_MARKERS = List.of("director", "head");
    private static final List<String> MANAGER_MARKERS = List.of("manager", "lead", "senior");

    private final LeadRepository leadRepository;
    private final TargetingRulesProvider rulesProvider;
    private final AiOutreachService aiOutreachService;
    private final RunRecorder runRecorder;

    @Override
    public PipelineStage stage() {
        return PipelineStage.ENRICH;
    }

    @Override
    public StageResult execute(StageContext context) {
        boolean aiMode = context.config().aiMode();
        Integer seed = context.config().seed();
        Random random = seed != null ? new Random(seed) : new Random();
        TargetingRules rules = rulesProvider.get();

        List<Lead> leads = leadRepository.findByStatusOrderByIdAsc(LeadStatus.NEW);
        List<RecordOutcome> outcomes = new ArrayList<>(leads.size());
        int aiFallbacks = 0;

        for (Lead lead : leads) {
            EnrichmentProfile profile;
            if (aiMode) {
                try {
                    profile = aiOutreachService.enrich(lead);
                } catch (RuntimeException e) {
                    log.warn("AI enrichment failed; falling back to heuristics: {}", e.getMessage());
                    profile = enrichWithHeuristics(lead, rules, random);
                    aiFallbacks++;
                }
            } else {
                profile = enrichWithHeuristics(lead, rules, random);
            }
            profile.applyTo(lead);
            lead.advanceTo(LeadStatus.ENRICHED);
            outcomes.add(RecordOutcome.succeeded(lead.getId()));
        }
        leadRepository.saveAll(leads);

        log.info("Enriched {} leads (aiMode={}, aiFallbacks={})", leads.size(), aiMode, aiFallbacks);
        runRecorder.logEvent(stage().wireName(), RunRecorder.LEVEL_INFO,
                "Enriched " + leads.size() + " leads ai_mode=" + aiMode, context.runId(), null);

        StageResult result = StageResult.of(stage(), outcomes);
        return aiMode ? result.withExtra(Map.of("aiFallbacks", aiFallbacks)) : result;
    }

    EnrichmentProfile enrichWithHeuristics(Lead lead, TargetingRules rules, Random random) {
        String industry = lead.getIndustry();

        List<String> pains = sample(rules.painsFor(industry), 2, random);
        if (pains.isEmpty()) {
            pains = sample(rules.defaultPains(), 2, random);
        }
        List<String> triggers = sample(rules.triggersFor(industry), 1, random);
        if (triggers.isEmpty()) {
            triggers = sample(rules.defaultTriggers(), 1, random);
        }

        return new EnrichmentProfile(
                rules.companySizeFor(industry),
                rules.personaFor(lead.getTitle()),
                pains,
                triggers,
                confidenceFor(lead, rules, random));
    }

    /**
     * Base 50, plus industry, seniority and market bonuses, +/-5 jitter, clamped to 55..98.
     */
    static double confidenceFor(Lead lead, TargetingRules rules, Random random) {
        double confidence = 50.0;

        if (rules.isKnownIndustry(lead.getIndustry())) {
            confidence += 15.0;
        }

        Set<String> titleWords = wordsOf(lead.getTitle());
        if (containsAny(titleWords, C_SUITE_MARKERS)) {
            confidence += 20.0;
        } else if (containsAny(titleWords, DIRECTOR_MARKERS)) {
            confidence += 15.0;
        } else if (containsAny(titleWords, MANAGER_MARKERS)) {
            confidence += 10.0;
        } else {
            confidence += uniform(random, 5, 12);
        }

        if (rules.isTier1Country(lead.getCountry())) {
            confidence += 10.0;
        } else {
            confidence += uniform(random, 3, 8);
        }

        confidence += uniform(random, -5, 5);

        double clamped = Math.max(55.0, Math.min(98.0, confidence));
        return Math.round(clamped * 10.0) / 10.0;
    }

    private static List<String> sample(List<String> items, int k, Random random) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<String> pool = new ArrayList<>(items);
        List<String> picked = new ArrayList<>();
        for (int i = 0; i < Math.min(k, pool.size()); i++) {
            picked.add(pool.remove(random.nextInt(pool.size())));
        }
        return picked;
    }

    // Lowercased alphabetic tokens of the title.
    private static Set<String> wordsOf(String title) {
        if (title == null || title.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(title.toLowerCase(Locale.ROOT).split("[^a-z]+"))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toSet());
    }

    private static boolean containsAny(Set<String> words, List<String> markers) {
        return markers.stream().anyMatch(words::contains);
    }

    private static double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }
}
