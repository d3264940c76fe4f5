package com.outreachagent.infrastructure.stage;

import com.outreachagent.application.tracking.RunRecorder;
import com.outreachagent.domain.lead.model.Lead;
import com.outreachagent.domain.lead.model.LeadStatus;
import com.outreachagent.domain.lead.model.Message;
import com.outreachagent.domain.lead.repository.LeadRepository;
import com.outreachagent.domain.lead.repository.MessageRepository;
import com.outreachagent.domain.pipeline.model.PipelineStage;
import com.outreachagent.domain.pipeline.model.RecordOutcome;
import com.outreachagent.domain.pipeline.model.StageContext;
import com.outreachagent.domain.pipeline.model.StageResult;
import com.outreachagent.domain.pipeline.service.PipelineStageHandler;
import com.outreachagent.infrastructure.delivery.DeliveryGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands every COMPOSED lead with its latest message to the {@link DeliveryGuard}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutreachSender implements PipelineStageHandler {

    private final LeadRepository leadRepository;
    private final MessageRepository messageRepository;
    private final DeliveryGuard deliveryGuard;
    private final RunRecorder runRecorder;

    @Override
    public PipelineStage stage() {
        return PipelineStage.DELIVER;
    }

    @Override
    public StageResult execute(StageContext context) {
        boolean dryRun = context.config().dryRun();
        List<Lead> leads = leadRepository.findByStatusOrderByIdAsc(LeadStatus.COMPOSED);
        List<RecordOutcome> outcomes = new ArrayList<>(leads.size());
        deliveryGuard.beginBatch();

        for (Lead lead : leads) {
            Message message = messageRepository.findTopByLeadIdOrderByIdDesc(lead.getId()).orElse(null);
            outcomes.add(deliveryGuard.deliver(lead, message, dryRun, context.runId()).toRecordOutcome());
        }

        StageResult result = StageResult.of(stage(), outcomes);
        log.info("Delivery finished (dryRun={}): sent={}, failed={}, skipped={}",
                dryRun, result.succeeded(), result.failed(), result.skipped());
        runRecorder.logEvent(stage().wireName(), RunRecorder.LEVEL_INFO,
                "Sent " + result.succeeded() + " messages, " + result.failed() + " failed (dry_run=" + dryRun + ")",
                context.runId(), null);

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("sent", result.succeeded());
        extra.put("failed", result.failed());
        extra.put("skipped", result.skipped());
        return result.withExtra(extra);
    }
}
