package com.outreachagent.infrastructure.stage;

import com.outreachagent.application.tracking.RunRecorder;
import com.outreachagent.domain.lead.model.EnrichmentProfile;
import com.outreachagent.domain.lead.model.Lead;
import com.outreachagent.domain.lead.model.LeadStatus;
import com.outreachagent.domain.lead.repository.LeadRepository;
import com.outreachagent.domain.pipeline.model.RunConfig;
import com.outreachagent.domain.pipeline.model.StageContext;
import com.outreachagent.domain.pipeline.model.StageResult;
import com.outreachagent.infrastructure.ai.AiConfigurationException;
import com.outreachagent.infrastructure.ai.AiOutreachService;
import com.outreachagent.support.TestLeads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeadEnricherTest {

    @Mock
    private LeadRepository leadRepository;

    @Mock
    private TargetingRulesProvider rulesProvider;

    @Mock
    private AiOutreachService aiOutreachService;

    @Mock
    private RunRecorder runRecorder;

    @InjectMocks
    private LeadEnricher enricher;

    @BeforeEach
    void setUp() {
        lenient().when(rulesProvider.get()).thenReturn(TargetingRules.defaults());
    }

    private static StageContext context(boolean aiMode, Integer seed) {
        return new StageContext(1L, new RunConfig(true, aiMode, seed, 10));
    }

    @Nested
    @DisplayName("Heuristic mode")
    class Heuristic {

        @Test
        @DisplayName("Every NEW lead is enriched from the rule tables and advanced")
        void enrichesAllNewLeads() {
            Lead vp = TestLeads.lead(1L, "Mary Johnson", "VP Operations", "Manufacturing", "US");
            Lead lead = TestLeads.lead(2L, "Wei Chen", "Operations Lead", "Retail", "SG");
            when(leadRepository.findByStatusOrderByIdAsc(LeadStatus.NEW)).thenReturn(List.of(vp, lead));

            StageResult result = enricher.execute(context(false, 42));

            assertThat(result.count()).isEqualTo(2);
            assertThat(vp.getStatus()).isEqualTo(LeadStatus.ENRICHED);
            assertThat(vp.getCompanySize()).isEqualTo("Enterprise");
            assertThat(vp.getPersona()).isEqualTo("Executive");
            assertThat(vp.getPains().split("; ")).hasSize(2)
                    .allSatisfy(pain -> assertThat(TargetingRules.defaults().painsFor("Manufacturing")).contains(pain));
            assertThat(vp.getTriggers().split("; ")).hasSize(1);
            assertThat(lead.getCompanySize()).isEqualTo("Mid-Market");
            assertThat(lead.getPersona()).isEqualTo("Team Lead");
            assertThat(List.of(vp.getConfidence(), lead.getConfidence()))
                    .allSatisfy(c -> assertThat(c).isBetween(55.0, 98.0));
            verify(leadRepository).saveAll(List.of(vp, lead));
            verify(aiOutreachService, never()).enrich(any());
        }

        @Test
        @DisplayName("The same seed yields the same enrichment")
        void seeded_isDeterministic() {
            Lead first = TestLeads.lead(1L, "Mary Johnson", "Plant Manager", "Manufacturing", "IN");
            Lead second = TestLeads.lead(1L, "Mary Johnson", "Plant Manager", "Manufacturing", "IN");
            when(leadRepository.findByStatusOrderByIdAsc(LeadStatus.NEW))
                    .thenReturn(List.of(first))
                    .thenReturn(List.of(second));

            enricher.execute(context(false, 7));
            enricher.execute(context(false, 7));

            assertThat(second.getConfidence()).isEqualTo(first.getConfidence());
            assertThat(second.getPains()).isEqualTo(first.getPains());
            assertThat(second.getTriggers()).isEqualTo(first.getTriggers());
        }
    }

    @Nested
    @DisplayName("AI mode")
    class AiMode {

        @Test
        @DisplayName("AI profile is applied when the call succeeds")
        void aiSuccess_applied() {
            Lead lead = TestLeads.lead(1L);
            when(leadRepository.findByStatusOrderByIdAsc(LeadStatus.NEW)).thenReturn(List.of(lead));
            when(aiOutreachService.enrich(lead)).thenReturn(new EnrichmentProfile(
                    "Enterprise", "Operations Leader", List.of("Supplier risk"), List.of("New plant"), 81.0));

            StageResult result = enricher.execute(context(true, 1));

            assertThat(lead.getStatus()).isEqualTo(LeadStatus.ENRICHED);
            assertThat(lead.getPersona()).isEqualTo("Operations Leader");
            assertThat(lead.getConfidence()).isEqualTo(81.0);
            assertThat(result.extra()).containsEntry("aiFallbacks", 0);
        }

        @Test
        @DisplayName("A missing API key falls back to heuristics and still advances")
        void aiFailure_fallsBackToHeuristics() {
            Lead lead = TestLeads.lead(1L);
            when(leadRepository.findByStatusOrderByIdAsc(LeadStatus.NEW)).thenReturn(List.of(lead));
            when(aiOutreachService.enrich(lead)).thenThrow(new AiConfigurationException("OPENAI_API_KEY not set"));

            StageResult result = enricher.execute(context(true, 1));

            assertThat(result.count()).isEqualTo(1);
            assertThat(lead.getStatus()).isEqualTo(LeadStatus.ENRICHED);
            assertThat(lead.getCompanySize()).isEqualTo("Enterprise");
            assertThat(result.extra()).containsEntry("aiFallbacks", 1);
        }
    }

    @Test
    @DisplayName("Senior titles in tier-1 markets of known industries score high, capped at 98")
    void confidence_bounds() {
        TargetingRules rules = TargetingRules.defaults();
        Lead cto = TestLeads.lead(1L, "Lukas Schmidt", "CTO", "Software", "DE");
        Lead unknown = TestLeads.lead(2L, "Amara Okafor", "Analyst", "Agriculture", "NG");
        Random random = new Random(3);

        for (int i = 0; i < 200; i++) {
            assertThat(LeadEnricher.confidenceFor(cto, rules, random)).isBetween(90.0, 98.0);
            assertThat(LeadEnricher.confidenceFor(unknown, rules, random)).isBetween(55.0, 75.0);
        }
    }
}
