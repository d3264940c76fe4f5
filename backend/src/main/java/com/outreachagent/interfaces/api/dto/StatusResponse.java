package com.outreachagent.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponse(String status, String message, Long runId) {

    public static StatusResponse ok(String message) {
        return new StatusResponse("ok", message, null);
    }

    public static StatusResponse started(Long runId) {
        return new StatusResponse("ok", "Pipeline started", runId);
    }
}
