package com.outreachagent;

import com.outreachagent.application.lead.LeadQueryService;
import com.outreachagent.application.pipeline.PipelineOrchestrator;
import com.outreachagent.application.tracking.RunRecorder;
import com.outreachagent.domain.lead.model.Lead;
import com.outreachagent.domain.pipeline.model.PipelineEvent;
import com.outreachagent.domain.pipeline.model.PipelineEventType;
import com.outreachagent.domain.pipeline.model.PipelineStage;
import com.outreachagent.domain.pipeline.model.PipelineState;
import com.outreachagent.domain.pipeline.model.RunConfig;
import com.outreachagent.domain.run.model.Run;
import com.outreachagent.domain.run.repository.RunRepository;
import com.outreachagent.infrastructure.events.EventBroadcaster;
import com.outreachagent.infrastructure.events.EventSubscription;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class PipelineFlowIntegrationTest {

    @Autowired
    private PipelineOrchestrator pipelineOrchestrator;

    @Autowired
    private LeadQueryService leadQueryService;

    @Autowired
    private RunRecorder runRecorder;

    @Autowired
    private RunRepository runRepository;

    @Autowired
    private EventBroadcaster broadcaster;

    private EventSubscription events;

    @BeforeEach
    void setUp() throws InterruptedException {
        awaitIdle();
        leadQueryService.reset();
        events = broadcaster.subscribe();
    }

    @AfterEach
    void tearDown() {
        broadcaster.unsubscribe(events);
    }

    private void awaitIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 15_000;
        while (pipelineOrchestrator.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertThat(pipelineOrchestrator.isRunning()).isFalse();
    }

    private List<PipelineEvent> collectUntilTerminal() throws InterruptedException {
        List<PipelineEvent> received = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 15_000;
        while (System.currentTimeMillis() < deadline) {
            PipelineEvent event = events.poll(100, TimeUnit.MILLISECONDS);
            if (event == null) {
                continue;
            }
            received.add(event);
            if (event.is(PipelineEventType.PIPELINE_COMPLETED)
                    || event.is(PipelineEventType.PIPELINE_STOPPED)
                    || event.is(PipelineEventType.PIPELINE_ERROR)) {
                return received;
            }
        }
        throw new AssertionError("Run did not reach a terminal event; saw " + received);
    }

    @Test
    @DisplayName("A seeded dry run takes every lead from NEW to DELIVERED")
    void dryRun_deliversEveryLead() throws InterruptedException {
        Long runId = pipelineOrchestrator.start(new RunConfig(true, false, 42, 5));

        List<PipelineEvent> received = collectUntilTerminal();
        awaitIdle();

        PipelineEvent completed = received.get(received.size() - 1);
        assertThat(completed.type()).isEqualTo("pipeline_completed");
        assertThat(completed.data())
                .containsEntry("runId", runId)
                .containsEntry("sent", 5)
                .containsEntry("failed", 0);

        Map<String, Long> counts = runRecorder.countStatuses();
        assertThat(counts).containsEntry("DELIVERED", 5L).containsEntry("FAILED", 0L).containsEntry("NEW", 0L);

        Run run = runRepository.findById(runId).orElseThrow();
        assertThat(run.getOutcome()).isEqualTo("COMPLETED");
        assertThat(run.getMode()).isEqualTo(Run.MODE_DRY);
        assertThat(run.getSucceeded()).isEqualTo(5);
        assertThat(run.getFinishedAt()).isNotNull();

        assertThat(pipelineOrchestrator.status().pipelineState().state()).isEqualTo(PipelineState.COMPLETED);
        assertThat(pipelineOrchestrator.status().pipelineState().progressOf(PipelineStage.GENERATE).count()).isEqualTo(5);
    }

    @Test
    @DisplayName("Every delivered lead has composed copy and an audit trail")
    void dryRun_persistsMessagesAndLogs() throws InterruptedException {
        pipelineOrchestrator.start(new RunConfig(true, false, 7, 3));
        collectUntilTerminal();
        awaitIdle();

        List<Lead> leads = leadQueryService.findLeads("delivered", 10, 0);
        assertThat(leads).hasSize(3);
        for (Lead lead : leads) {
            LeadQueryService.LeadMessages messages = leadQueryService.findMessages(lead.getId());
            assertThat(messages.messages()).hasSize(1);
            assertThat(messages.messages().get(0).getEmailA()).contains(lead.getFirstName());
            assertThat(lead.getConfidence()).isBetween(55.0, 98.0);
        }
        assertThat(leadQueryService.recentLogs(100))
                .anySatisfy(entry -> assertThat(entry.getMessage()).startsWith("Dry-run send to"));
    }

    @Test
    @DisplayName("Live mode through the console transport also delivers")
    void liveRun_consoleTransport() throws InterruptedException {
        pipelineOrchestrator.start(new RunConfig(false, false, 3, 2));
        collectUntilTerminal();
        awaitIdle();

        assertThat(runRecorder.countStatuses()).containsEntry("DELIVERED", 2L);
    }

    @Test
    @DisplayName("AI mode without an API key falls back and still completes")
    void aiMode_withoutKey_fallsBack() throws InterruptedException {
        pipelineOrchestrator.start(new RunConfig(true, true, 11, 2));
        List<PipelineEvent> received = collectUntilTerminal();
        awaitIdle();

        assertThat(received.get(received.size() - 1).type()).isEqualTo("pipeline_completed");
        assertThat(runRecorder.countStatuses()).containsEntry("DELIVERED", 2L);
    }
}
