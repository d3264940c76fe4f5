package com.outreachagent.infrastructure.stage;

import com.outreachagent.application.tracking.RunRecorder;
import com.outreachagent.domain.lead.model.Lead;
import com.outreachagent.domain.lead.model.LeadStatus;
import com.outreachagent.domain.lead.model.MessageDraft;
import com.outreachagent.domain.lead.repository.LeadRepository;
import com.outreachagent.domain.lead.repository.MessageRepository;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes A/B email and DM copy for every ENRICHED lead and advances it to COMPOSED.
 * A lead that cannot be composed keeps its status and is reported as skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageComposer implements PipelineStageHandler {

    private final LeadRepository leadRepository;
    private final MessageRepository messageRepository;
    private final AiOutreachService aiOutreachService;
    private final RunRecorder runRecorder;

    @Override
    public PipelineStage stage() {
        return PipelineStage.COMPOSE;
    }

    @Override
    public StageResult execute(StageContext context) {
        boolean aiMode = context.config().aiMode();
        List<Lead> leads = leadRepository.findByStatusOrderByIdAsc(LeadStatus.ENRICHED);
        List<RecordOutcome> outcomes = new ArrayList<>(leads.size());
        int aiFallbacks = 0;

        for (Lead lead : leads) {
            try {
                MessageDraft draft;
                if (aiMode) {
                    try {
                        draft = aiOutreachService.compose(lead);
                    } catch (RuntimeException e) {
                        log.warn("AI message generation failed for {}, using template: {}",
                                lead.getFullName(), e.getMessage());
                        draft = MessageTemplates.draftFor(lead);
                        aiFallbacks++;
                    }
                } else {
                    draft = MessageTemplates.draftFor(lead);
                }

                messageRepository.save(draft.toMessage(lead.getId(), MessageTemplates.CTA));
                lead.advanceTo(LeadStatus.COMPOSED);
                leadRepository.save(lead);
                outcomes.add(RecordOutcome.succeeded(lead.getId()));
            } catch (RuntimeException e) {
                String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("Failed to compose messages for lead {}: {}", lead.getId(), reason);
                runRecorder.logEvent(stage().wireName(), RunRecorder.LEVEL_WARNING,
                        "Compose skipped: " + reason, context.runId(), lead.getId());
                outcomes.add(RecordOutcome.skipped(lead.getId(), reason));
            }
        }

        StageResult result = StageResult.of(stage(), outcomes);
        String mode = aiMode ? "AI" : "template";
        log.info("Composed messages for {} leads ({} mode, {} AI fallbacks, {} skipped)",
                result.count(), mode, aiFallbacks, result.skipped());
        runRecorder.logEvent(stage().wireName(), RunRecorder.LEVEL_INFO,
                "Composed messages for " + result.count() + " leads ai_mode=" + aiMode, context.runId(), null);

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("skipped", result.skipped());
        if (aiMode) {
            extra.put("aiFallbacks", aiFallbacks);
        }
        return result.withExtra(extra);
    }
}
