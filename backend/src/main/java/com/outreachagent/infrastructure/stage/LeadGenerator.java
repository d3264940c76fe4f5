package com.outreachagent.infrastructure.stage;

import com.outreachagent.application.tracking.RunRecorder;
import com.outreachagent.domain.lead.model.Lead;
import com.outreachagent.domain.lead.repository.LeadRepository;
import com.outreachagent.domain.pipeline.model.PipelineStage;
import com.outreachagent.domain.pipeline.model.RecordOutcome;
import com.outreachagent.domain.pipeline.model.StageContext;
import com.outreachagent.domain.pipeline.model.StageResult;
import com.outreachagent.domain.pipeline.service.PipelineStageHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Generates synthetic B2B leads in NEW status. Output is reproducible for a given seed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LeadGenerator implements PipelineStageHandler {

    // Industry to plausible roles
    static final Map<String, List<String>> INDUSTRY_ROLES = Map.of(
            "Software", List.of("VP Engineering", "Head of Product", "CTO", "Engineering Manager"),
            "Manufacturing", List.of("VP Operations", "Plant Manager", "Supply Chain Director"),
            "Retail", List.of("VP Merchandising", "Director of E-commerce", "Operations Lead"),
            "Healthcare", List.of("Director of Nursing", "VP Clinical Operations", "Health IT Lead"),
            "Logistics", List.of("VP Logistics", "Head of Procurement", "Supply Chain Lead"));

    private static final List<String> INDUSTRIES = List.of("Software", "Manufacturing", "Retail", "Healthcare", "Logistics");
    private static final List<String> COUNTRIES = List.of("US", "UK", "CA", "DE", "FR", "IN", "SG", "AU");

    private static final List<String> FIRST_NAMES = List.of(
            "James", "Mary", "Robert", "Patricia", "John", "Jennifer", "Michael", "Linda", "David", "Elizabeth",
            "William", "Barbara", "Richard", "Susan", "Joseph", "Jessica", "Thomas", "Sarah", "Priya", "Wei",
            "Carlos", "Fatima", "Lukas", "Sophie", "Hiroshi", "Amara", "Mateo", "Ingrid", "Rahul", "Chloe");
    private static final List<String> LAST_NAMES = List.of(
            "Smith", "Johnson", "Williams", "Brown", "Jones", "Garcia", "Miller", "Davis", "Rodriguez", "Martinez",
            "Hernandez", "Lopez", "Wilson", "Anderson", "Taylor", "Thomas", "Moore", "Jackson", "Martin", "Lee",
            "Patel", "Chen", "Schmidt", "Dubois", "Tanaka", "Okafor", "Silva", "Nielsen", "Kumar", "Walker");
    private static final List<String> COMPANY_STEMS = List.of(
            "Apex", "Blue Harbor", "Cobalt", "Driftwood", "Evergreen", "Foxglove", "Granite", "Horizon", "Ironclad",
            "Juniper", "Keystone", "Lumen", "Meridian", "Northwind", "Orchid", "Pinnacle", "Quarry", "Redwood",
            "Summit", "Tidewater", "Umbra", "Vantage", "Willow", "Zenith");
    private static final List<String> COMPANY_SUFFIXES = List.of(
            "Systems", "Labs", "Group", "Industries", "Solutions", "Partners", "Dynamics", "Works", "Holdings", "Logistics");
    private static final List<String> DOMAIN_TLDS = List.of("com", "io", "net", "co");

    private static final int LINKEDIN_SLUG_MAX = 60;

    private final LeadRepository leadRepository;
    private final RunRecorder runRecorder;

    @Override
    public PipelineStage stage() {
        return PipelineStage.GENERATE;
    }

    @Override
    @Transactional
    public StageResult execute(StageContext context) {
        int count = context.config().count();
        Integer seed = context.config().seed();
        Random random = seed != null ? new Random(seed) : new Random();

        List<Lead> leads = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            leads.add(generateLead(random));
        }
        List<Lead> saved = leadRepository.saveAll(leads);

        List<RecordOutcome> outcomes = saved.stream()
                .map(lead -> RecordOutcome.succeeded(lead.getId()))
                .toList();

        log.info("Generated {} leads", saved.size());
        runRecorder.logEvent(stage().wireName(), RunRecorder.LEVEL_INFO,
                "Generated " + saved.size() + " leads", context.runId(), null);
        return StageResult.of(stage(), outcomes);
    }

    Lead generateLead(Random random) {
        String industry = pick(INDUSTRIES, random);
        String name = pick(FIRST_NAMES, random) + " " + pick(LAST_NAMES, random);
        String company = pick(COMPANY_STEMS, random) + " " + pick(COMPANY_SUFFIXES, random);
        String domain = company.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "") + "." + pick(DOMAIN_TLDS, random);

        return Lead.builder()
                .fullName(name)
                .company(company)
                .title(pick(INDUSTRY_ROLES.get(industry), random))
                .industry(industry)
                .website("https://" + domain)
                .email(emailFor(name, domain))
                .linkedin(linkedinFor(name, company))
                .country(pick(COUNTRIES, random))
                .build();
    }

    static String emailFor(String name, String domain) {
        return name.toLowerCase(Locale.ROOT).replace(" ", ".") + "@" + domain;
    }

    static String linkedinFor(String name, String company) {
        String slug = String.join("-", (name + " " + company).toLowerCase(Locale.ROOT).trim().split("\\s+"));
        if (slug.length() > LINKEDIN_SLUG_MAX) {
            slug = slug.substring(0, LINKEDIN_SLUG_MAX);
        }
        return "https://www.linkedin.com/in/" + slug;
    }

    private static <T> T pick(List<T> items, Random random) {
        return items.get(random.nextInt(items.size()));
    }
}
