package com.outreachagent.interfaces.api.lead;

import com.outreachagent.application.lead.LeadQueryService;
import com.outreachagent.application.pipeline.PipelineMetrics;
import com.outreachagent.application.tracking.RunRecorder;
import com.outreachagent.infrastructure.stage.TargetingRules;
import com.outreachagent.infrastructure.stage.TargetingRulesProvider;
import com.outreachagent.interfaces.api.dto.ItemsResponse;
import com.outreachagent.interfaces.api.dto.LeadMessagesResponse;
import com.outreachagent.interfaces.api.dto.LeadResponse;
import com.outreachagent.interfaces.api.dto.LogEntryResponse;
import com.outreachagent.interfaces.api.dto.MessageResponse;
import com.outreachagent.interfaces.api.dto.StatusResponse;
import com.outreachagent.interfaces.api.dto.TargetingRulesResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class LeadController {

    private final LeadQueryService leadQueryService;
    private final RunRecorder runRecorder;
    private final TargetingRulesProvider targetingRulesProvider;

    @GetMapping("/metrics")
    public ResponseEntity<PipelineMetrics> metrics() {
        return ResponseEntity.ok(PipelineMetrics.from(runRecorder.countStatuses()));
    }

    @GetMapping("/leads")
    public ResponseEntity<ItemsResponse<LeadResponse>> leads(@RequestParam(required = false) String status,
                                                             @RequestParam(defaultValue = "50") int limit,
                                                             @RequestParam(defaultValue = "0") int offset) {
        List<LeadResponse> items = leadQueryService.findLeads(status, limit, offset).stream()
                .map(LeadResponse::from)
                .toList();
        return ResponseEntity.ok(new ItemsResponse<>(items));
    }

    @GetMapping("/leads/{leadId}/messages")
    public ResponseEntity<LeadMessagesResponse> messages(@PathVariable Long leadId) {
        LeadQueryService.LeadMessages result = leadQueryService.findMessages(leadId);
        return ResponseEntity.ok(new LeadMessagesResponse(
                LeadResponse.from(result.lead()),
                result.messages().stream().map(MessageResponse::from).toList()));
    }

    @GetMapping("/logs")
    public ResponseEntity<ItemsResponse<LogEntryResponse>> logs(@RequestParam(defaultValue = "100") int limit) {
        List<LogEntryResponse> items = leadQueryService.recentLogs(limit).stream()
                .map(LogEntryResponse::from)
                .toList();
        return ResponseEntity.ok(new ItemsResponse<>(items));
    }

    @PostMapping("/reset")
    public ResponseEntity<StatusResponse> reset() {
        leadQueryService.reset();
        return ResponseEntity.ok(StatusResponse.ok("Database cleared"));
    }

    @GetMapping("/config/targeting-rules")
    public ResponseEntity<TargetingRulesResponse> targetingRules() {
        return ResponseEntity.ok(TargetingRulesResponse.ok(targetingRulesProvider.get()));
    }

    @PutMapping("/config/targeting-rules")
    public ResponseEntity<TargetingRulesResponse> updateTargetingRules(@RequestBody TargetingRules rules) {
        return ResponseEntity.ok(TargetingRulesResponse.updated(targetingRulesProvider.update(rules)));
    }
}
