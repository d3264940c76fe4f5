package com.outreachagent.interfaces.api.lead;

import com.outreachagent.application.lead.LeadQueryService;
import com.outreachagent.application.lead.exception.LeadNotFoundException;
import com.outreachagent.application.pipeline.exception.PipelineBusyException;
import com.outreachagent.application.tracking.RunRecorder;
import com.outreachagent.domain.lead.model.LeadStatus;
import com.outreachagent.infrastructure.stage.TargetingRules;
import com.outreachagent.infrastructure.stage.TargetingRulesProvider;
import com.outreachagent.support.TestLeads;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LeadController.class)
class LeadControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LeadQueryService leadQueryService;

    @MockBean
    private RunRecorder runRecorder;

    @MockBean
    private TargetingRulesProvider targetingRulesProvider;

    @Test
    @DisplayName("GET /metrics sums the per-status counts")
    void metrics() throws Exception {
        when(runRecorder.countStatuses()).thenReturn(Map.of("NEW", 3L, "DELIVERED", 2L));

        mockMvc.perform(get("/api/v1/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(5))
                .andExpect(jsonPath("$.statusCounts.DELIVERED").value(2));
    }

    @Test
    @DisplayName("GET /leads passes filter and paging through")
    void leads() throws Exception {
        when(leadQueryService.findLeads("composed", 10, 20))
                .thenReturn(List.of(TestLeads.inStatus(7L, LeadStatus.COMPOSED)));

        mockMvc.perform(get("/api/v1/leads")
                        .param("status", "composed")
                        .param("limit", "10")
                        .param("offset", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].id").value(7))
                .andExpect(jsonPath("$.items[0].name").value("Mary Johnson"))
                .andExpect(jsonPath("$.items[0].status").value("COMPOSED"));
    }

    @Test
    @DisplayName("GET /leads with an unknown status is a 400")
    void leads_unknownStatus() throws Exception {
        when(leadQueryService.findLeads("bogus", 50, 0))
                .thenThrow(new IllegalArgumentException("Unknown lead status: bogus"));

        mockMvc.perform(get("/api/v1/leads").param("status", "bogus"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown lead status: bogus"));
    }

    @Test
    @DisplayName("GET /leads/{id}/messages returns the lead with its drafts")
    void messages() throws Exception {
        when(leadQueryService.findMessages(7L)).thenReturn(new LeadQueryService.LeadMessages(
                TestLeads.lead(7L), List.of(TestLeads.message(7L))));

        mockMvc.perform(get("/api/v1/leads/7/messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lead.id").value(7))
                .andExpect(jsonPath("$.messages[0].emailA").value("Hi Mary, email A"));
    }

    @Test
    @DisplayName("GET /leads/{id}/messages for a missing lead is a 404")
    void messages_missingLead() throws Exception {
        when(leadQueryService.findMessages(99L)).thenThrow(new LeadNotFoundException(99L));

        mockMvc.perform(get("/api/v1/leads/99/messages"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("LEAD_NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /reset clears the store")
    void reset() throws Exception {
        mockMvc.perform(post("/api/v1/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Database cleared"));

        verify(leadQueryService).reset();
    }

    @Test
    @DisplayName("POST /reset during a run is a 409")
    void reset_busy() throws Exception {
        doThrow(new PipelineBusyException()).when(leadQueryService).reset();

        mockMvc.perform(post("/api/v1/reset"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("PIPELINE_BUSY"));
    }

    @Test
    @DisplayName("GET /config/targeting-rules returns the loaded rules")
    void targetingRules() throws Exception {
        when(targetingRulesProvider.get()).thenReturn(TargetingRules.defaults());

        mockMvc.perform(get("/api/v1/config/targeting-rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.rules").exists());
    }

    @Test
    @DisplayName("PUT /config/targeting-rules saves and returns the new rules")
    void updateTargetingRules() throws Exception {
        when(targetingRulesProvider.update(any(TargetingRules.class))).thenAnswer(invocation -> invocation.getArgument(0));

        mockMvc.perform(put("/api/v1/config/targeting-rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"company_size_rules": {"Fintech": "Startup"},
                                 "persona_rules": {"Founder": "Founder"},
                                 "pain_points": {"Fintech": ["Fraud losses"]},
                                 "triggers": {"Fintech": ["Series A"]}}"""))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Targeting rules updated"))
                .andExpect(jsonPath("$.rules.company_size_rules.Fintech").value("Startup"));

        ArgumentCaptor<TargetingRules> captor = ArgumentCaptor.forClass(TargetingRules.class);
        verify(targetingRulesProvider).update(captor.capture());
        assertThat(captor.getValue().painsFor("Fintech")).containsExactly("Fraud losses");
    }

    @Test
    @DisplayName("PUT /config/targeting-rules with a missing table is a 400")
    void updateTargetingRules_invalid() throws Exception {
        when(targetingRulesProvider.update(any(TargetingRules.class)))
                .thenThrow(new IllegalArgumentException("Missing required key: triggers"));

        mockMvc.perform(put("/api/v1/config/targeting-rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"company_size_rules\": {\"Fintech\": \"Startup\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing required key: triggers"));
    }
}
