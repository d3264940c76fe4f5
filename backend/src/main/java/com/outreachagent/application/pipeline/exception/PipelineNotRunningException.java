package com.outreachagent.application.pipeline.exception;

public class PipelineNotRunningException extends RuntimeException {
    public PipelineNotRunningException() {
        super("not running");
    }
}
