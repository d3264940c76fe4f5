package com.outreachagent.application.pipeline;

import com.outreachagent.domain.pipeline.model.CancellationToken;
import com.outreachagent.domain.pipeline.model.PipelineSnapshot;
import com.outreachagent.domain.pipeline.model.PipelineStage;
import com.outreachagent.domain.pipeline.model.PipelineState;
import com.outreachagent.domain.pipeline.model.StageProgress;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns the single live pipeline snapshot.
 * <p>
 * Every read and write goes through this object's monitor, so status queries
 * always see a consistent copy even while the worker is mid-run.
 * </p>
 */
@Component
public class PipelineStateTracker {

    private PipelineState state = PipelineState.IDLE;
    private boolean running;
    private PipelineStage currentStage;
    private Long runId;
    private CancellationToken token = new CancellationToken();
    private Map<String, StageProgress> progress = PipelineSnapshot.pendingProgress();

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * Replaces the snapshot wholesale for a new run and hands out its stop token.
     *
     * @throws IllegalStateException if a run is still active
     */
    public synchronized CancellationToken begin() {
        if (running) {
            throw new IllegalStateException("A run is already active");
        }
        state = PipelineState.STARTING;
        running = true;
        currentStage = null;
        runId = null;
        token = new CancellationToken();
        progress = PipelineSnapshot.pendingProgress();
        return token;
    }

    public synchronized void attachRun(Long runId) {
        this.runId = runId;
    }

    /**
     * Undoes {@link #begin()} when the run could not be launched.
     */
    public synchronized void abortStart() {
        state = PipelineState.IDLE;
        running = false;
        currentStage = null;
        token = new CancellationToken();
    }

    /**
     * @return false if no run is active
     */
    public synchronized boolean requestStop() {
        if (!running) {
            return false;
        }
        token.requestCancellation();
        state = PipelineState.STOPPING;
        return true;
    }

    public synchronized void stageStarted(PipelineStage stage) {
        if (state != PipelineState.STOPPING) {
            state = PipelineState.RUNNING;
        }
        currentStage = stage;
        progress.put(stage.wireName(), progress.get(stage.wireName()).running());
    }

    public synchronized void stageCompleted(PipelineStage stage, int count, Map<String, Object> extra) {
        progress.put(stage.wireName(), progress.get(stage.wireName()).completed(count, extra));
    }

    /**
     * Terminal transition: clears the running flag and resets the stop flag.
     */
    public synchronized void finish(PipelineState terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not a terminal state");
        }
        state = terminal;
        running = false;
        currentStage = null;
        token = new CancellationToken();
    }

    public synchronized PipelineSnapshot snapshot() {
        return new PipelineSnapshot(state, running, currentStage,
                token.isCancellationRequested(), runId, new LinkedHashMap<>(progress));
    }
}
