package com.outreachagent.application.pipeline;

import com.outreachagent.application.pipeline.exception.PipelineBusyException;
import com.outreachagent.application.pipeline.exception.PipelineNotRunningException;
import com.outreachagent.application.tracking.RunRecorder;
import com.outreachagent.domain.pipeline.model.CancellationToken;
import com.outreachagent.domain.pipeline.model.PipelineEvent;
import com.outreachagent.domain.pipeline.model.PipelineEventType;
import com.outreachagent.domain.pipeline.model.PipelineStage;
import com.outreachagent.domain.pipeline.model.PipelineState;
import com.outreachagent.domain.pipeline.model.RunConfig;
import com.outreachagent.domain.pipeline.model.StageContext;
import com.outreachagent.domain.pipeline.model.StageResult;
import com.outreachagent.domain.pipeline.service.PipelineStageHandler;
import com.outreachagent.infrastructure.config.PipelineExecutionConfig;
import com.outreachagent.infrastructure.events.EventBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the run lifecycle: generate → enrich → compose → deliver on a background worker.
 * <p>
 * {@link #start(RunConfig)} and {@link #stop()} return immediately; stage work never
 * runs on the calling thread. Cancellation is cooperative and checked only between
 * stages, so the worst-case stop latency is the duration of the stage in progress.
 * </p>
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private final Map<PipelineStage, PipelineStageHandler> handlers;
    private final PipelineStateTracker stateTracker;
    private final EventBroadcaster broadcaster;
    private final RunRecorder runRecorder;
    private final Executor executor;

    private final Object lifecycleLock = new Object();

    public PipelineOrchestrator(List<PipelineStageHandler> stageHandlers,
                                PipelineStateTracker stateTracker,
                                EventBroadcaster broadcaster,
                                RunRecorder runRecorder,
                                @Qualifier(PipelineExecutionConfig.PIPELINE_EXECUTOR) Executor executor) {
        this.handlers = new EnumMap<>(PipelineStage.class);
        for (PipelineStageHandler handler : stageHandlers) {
            PipelineStageHandler previous = handlers.put(handler.stage(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for stage " + handler.stage());
            }
        }
        for (PipelineStage stage : PipelineStage.values()) {
            if (!handlers.containsKey(stage)) {
                throw new IllegalStateException("No handler registered for stage " + stage);
            }
        }
        this.stateTracker = stateTracker;
        this.broadcaster = broadcaster;
        this.runRecorder = runRecorder;
        this.executor = executor;
    }

    /**
     * Launches a run in the background.
     *
     * @return the new run id
     * @throws PipelineBusyException if a run is already active; nothing is mutated
     */
    public Long start(RunConfig config) {
        synchronized (lifecycleLock) {
            if (stateTracker.isRunning()) {
                throw new PipelineBusyException();
            }

            CancellationToken token = stateTracker.begin();
            Long runId;
            try {
                runId = runRecorder.startRun(config);
            } catch (RuntimeException e) {
                stateTracker.abortStart();
                throw e;
            }
            stateTracker.attachRun(runId);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("runId", runId);
            data.put("config", config.toEventData());
            broadcaster.publish(PipelineEvent.of(PipelineEventType.PIPELINE_STARTED, data));

            try {
                executor.execute(() -> runPipeline(runId, config, token));
            } catch (RejectedExecutionException e) {
                log.error("[Pipeline] Worker rejected run {}", runId, e);
                terminate(runId, PipelineState.ERROR, 0, 0, PipelineEvent.of(PipelineEventType.PIPELINE_ERROR,
                        Map.of("runId", runId, "error", "Pipeline worker unavailable")));
                throw new IllegalStateException("Pipeline worker unavailable", e);
            }

            log.info("[Pipeline] Run {} started (dryRun={}, aiMode={}, seed={}, count={})",
                    runId, config.dryRun(), config.aiMode(), config.seed(), config.count());
            return runId;
        }
    }

    /**
     * Requests a cooperative stop. The stage in progress runs to completion.
     *
     * @throws PipelineNotRunningException if no run is active
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!stateTracker.isRunning()) {
                throw new PipelineNotRunningException();
            }
            // Published before the token flips so pipeline_stopped can never overtake it.
            broadcaster.publish(PipelineEvent.of(PipelineEventType.PIPELINE_STOPPING,
                    Map.of("message", "Stop requested")));
            stateTracker.requestStop();
        }
        log.info("[Pipeline] Stop requested; will halt at the next stage boundary");
    }

    /**
     * Runs {@code action} while holding the lifecycle lock, so no run can start meanwhile.
     *
     * @throws PipelineBusyException if a run is active
     */
    public void whileIdle(Runnable action) {
        synchronized (lifecycleLock) {
            if (stateTracker.isRunning()) {
                throw new PipelineBusyException();
            }
            action.run();
        }
    }

    public PipelineStatusView status() {
        return new PipelineStatusView(stateTracker.snapshot(), PipelineMetrics.from(runRecorder.countStatuses()));
    }

    public boolean isRunning() {
        return stateTracker.isRunning();
    }

    void runPipeline(Long runId, RunConfig config, CancellationToken token) {
        StageContext context = new StageContext(runId, config);
        StageResult deliverResult = null;

        try {
            for (PipelineStage stage : PipelineStage.values()) {
                if (token.isCancellationRequested()) {
                    onStopped(runId, stage, deliverResult);
                    return;
                }
                StageResult result = runStage(stage, context);
                if (stage == PipelineStage.DELIVER) {
                    deliverResult = result;
                }
            }
            onCompleted(runId, config, deliverResult);
        } catch (Throwable e) {
            onError(runId, e, deliverResult);
            if (e instanceof Error) {
                throw (Error) e;
            }
        } finally {
            // Any exit path must leave the controller ready for the next start.
            if (stateTracker.isRunning()) {
                log.warn("[Pipeline] Run {} left running state unexpectedly; forcing ERROR", runId);
                stateTracker.finish(PipelineState.ERROR);
            }
        }
    }

    private StageResult runStage(PipelineStage stage, StageContext context) {
        stateTracker.stageStarted(stage);
        broadcaster.publish(PipelineEvent.of(PipelineEventType.STAGE_STARTED, Map.of("stage", stage.wireName())));
        runRecorder.logEvent(stage.wireName(), RunRecorder.LEVEL_INFO, "Stage started", context.runId(), null);

        long startedAt = System.currentTimeMillis();
        StageResult result = handlers.get(stage).execute(context);
        long elapsed = System.currentTimeMillis() - startedAt;

        stateTracker.stageCompleted(stage, result.count(), result.extra());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("stage", stage.wireName());
        data.put("count", result.count());
        data.putAll(result.extra());
        broadcaster.publish(PipelineEvent.of(PipelineEventType.STAGE_COMPLETED, data));

        log.info("[Pipeline] Stage {} completed: count={}, skipped={}, failed={}, {} ms",
                stage.wireName(), result.count(), result.skipped(), result.failed(), elapsed);

        if (stage.reportsMetrics()) {
            PipelineMetrics metrics = PipelineMetrics.from(runRecorder.countStatuses());
            broadcaster.publish(PipelineEvent.of(PipelineEventType.METRICS_UPDATE, metrics.toEventData()));
        }
        return result;
    }

    private void onCompleted(Long runId, RunConfig config, StageResult deliverResult) {
        int sent = deliverResult == null ? 0 : (int) deliverResult.succeeded();
        int failed = deliverResult == null ? 0 : (int) deliverResult.failed();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("runId", runId);
        data.put("total", config.count());
        data.put("sent", sent);
        data.put("failed", failed);
        terminate(runId, PipelineState.COMPLETED, sent, failed,
                PipelineEvent.of(PipelineEventType.PIPELINE_COMPLETED, data));
        log.info("[Pipeline] Run {} completed: sent={}, failed={}", runId, sent, failed);
    }

    private void onStopped(Long runId, PipelineStage nextStage, StageResult deliverResult) {
        int sent = deliverResult == null ? 0 : (int) deliverResult.succeeded();
        int failed = deliverResult == null ? 0 : (int) deliverResult.failed();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("runId", runId);
        data.put("message", "Pipeline stopped by user");
        data.put("stoppedBefore", nextStage.wireName());
        terminate(runId, PipelineState.STOPPED, sent, failed,
                PipelineEvent.of(PipelineEventType.PIPELINE_STOPPED, data));
        log.info("[Pipeline] Run {} stopped before stage {}", runId, nextStage.wireName());
    }

    private void onError(Long runId, Throwable error, StageResult deliverResult) {
        log.error("[Pipeline] Run {} failed", runId, error);
        int sent = deliverResult == null ? 0 : (int) deliverResult.succeeded();
        int failed = deliverResult == null ? 0 : (int) deliverResult.failed();

        String description = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("runId", runId);
        data.put("error", description);
        terminate(runId, PipelineState.ERROR, sent, failed,
                PipelineEvent.of(PipelineEventType.PIPELINE_ERROR, data));
    }

    /**
     * Finalizes the Run, releases the running flag and publishes the terminal event,
     * all under the lifecycle lock so stop and start see the three as one step.
     */
    private void terminate(Long runId, PipelineState terminal, int succeeded, int failed,
                           PipelineEvent terminalEvent) {
        synchronized (lifecycleLock) {
            try {
                runRecorder.finishRun(runId, terminal.name(), succeeded, failed);
            } catch (RuntimeException e) {
                log.error("[Pipeline] Failed to finalize run {} as {}", runId, terminal, e);
            } finally {
                stateTracker.finish(terminal);
                broadcaster.publish(terminalEvent);
            }
        }
    }
}
