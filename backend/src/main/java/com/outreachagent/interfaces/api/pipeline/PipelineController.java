package com.outreachagent.interfaces.api.pipeline;

import com.outreachagent.application.pipeline.PipelineOrchestrator;
import com.outreachagent.application.pipeline.PipelineStatusView;
import com.outreachagent.domain.pipeline.model.RunConfig;
import com.outreachagent.interfaces.api.dto.StartPipelineRequest;
import com.outreachagent.interfaces.api.dto.StatusResponse;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private final PipelineOrchestrator pipelineOrchestrator;
    private final PipelineEventStreamer eventStreamer;
    private final int defaultCount;
    private final int maxCount;

    public PipelineController(PipelineOrchestrator pipelineOrchestrator,
                              PipelineEventStreamer eventStreamer,
                              @Value("${outreach.pipeline.default-count:200}") int defaultCount,
                              @Value("${outreach.pipeline.max-count:1000}") int maxCount) {
        this.pipelineOrchestrator = pipelineOrchestrator;
        this.eventStreamer = eventStreamer;
        this.defaultCount = defaultCount;
        this.maxCount = maxCount;
    }

    @PostMapping("/start")
    public ResponseEntity<StatusResponse> start(@Valid @RequestBody(required = false) StartPipelineRequest request) {
        StartPipelineRequest body = request != null ? request : new StartPipelineRequest(null, null, null, null);
        RunConfig config = body.toRunConfig(defaultCount);
        if (config.count() > maxCount) {
            throw new IllegalArgumentException("count must not exceed " + maxCount);
        }
        Long runId = pipelineOrchestrator.start(config);
        return ResponseEntity.ok(StatusResponse.started(runId));
    }

    @PostMapping("/stop")
    public ResponseEntity<StatusResponse> stop() {
        pipelineOrchestrator.stop();
        return ResponseEntity.ok(StatusResponse.ok("Stop signal sent"));
    }

    @GetMapping("/status")
    public ResponseEntity<PipelineStatusView> status() {
        return ResponseEntity.ok(pipelineOrchestrator.status());
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return eventStreamer.open(pipelineOrchestrator.status().pipelineState());
    }
}
