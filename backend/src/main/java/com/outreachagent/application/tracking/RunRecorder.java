package com.outreachagent.application.tracking;

import com.outreachagent.domain.lead.model.LeadStatus;
import com.outreachagent.domain.lead.repository.LeadRepository;
import com.outreachagent.domain.pipeline.model.RunConfig;
import com.outreachagent.domain.run.model.LogEntry;
import com.outreachagent.domain.run.model.Run;
import com.outreachagent.domain.run.repository.LogEntryRepository;
import com.outreachagent.domain.run.repository.RunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists run metadata and structured audit events.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunRecorder {

    public static final String LEVEL_INFO = "INFO";
    public static final String LEVEL_WARNING = "WARNING";
    public static final String LEVEL_ERROR = "ERROR";

    private static final String RUN_STAGE = "run";

    private final RunRepository runRepository;
    private final LogEntryRepository logEntryRepository;
    private final LeadRepository leadRepository;

    @Transactional
    public Long startRun(RunConfig config) {
        Run run = runRepository.save(new Run(config.dryRun(), config.aiMode(), config.seed(), config.count()));
        logEvent(RUN_STAGE, LEVEL_INFO, "Run started", run.getId(), null);
        return run.getId();
    }

    @Transactional
    public void finishRun(Long runId, String outcome, int succeeded, int failed) {
        runRepository.findById(runId).ifPresentOrElse(run -> {
            if (run.isFinished()) {
                log.warn("[Run] Run {} already finalized as {}, ignoring {}", runId, run.getOutcome(), outcome);
                return;
            }
            run.finish(outcome, succeeded, failed);
        }, () -> log.warn("[Run] Run {} not found when finalizing", runId));
        logEvent(RUN_STAGE, LEVEL_INFO,
                String.format("Run finished: %s (succeeded=%d, failed=%d)", outcome, succeeded, failed),
                runId, null);
    }

    public void logEvent(String stage, String level, String message, Long runId, Long leadId) {
        logEntryRepository.save(new LogEntry(runId, leadId, stage, level, message));
        switch (level) {
            case LEVEL_ERROR -> log.error("[{}] {}", stage, message);
            case LEVEL_WARNING -> log.warn("[{}] {}", stage, message);
            default -> log.info("[{}] {}", stage, message);
        }
    }

    /**
     * Per-status lead counts in status order, zeros included.
     */
    @Transactional(readOnly = true)
    public Map<String, Long> countStatuses() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (LeadStatus status : LeadStatus.values()) {
            counts.put(status.name(), leadRepository.countByStatus(status));
        }
        return counts;
    }
}
