package com.outreachagent.application.pipeline.exception;

public class PipelineBusyException extends RuntimeException {
    public PipelineBusyException() {
        super("already running");
    }
}
