package com.outreachagent.interfaces.api.dto;

import com.outreachagent.domain.run.model.LogEntry;

import java.time.LocalDateTime;

public record LogEntryResponse(
        LocalDateTime ts,
        Long runId,
        Long leadId,
        String stage,
        String level,
        String message
) {

    public static LogEntryResponse from(LogEntry entry) {
        return new LogEntryResponse(
                entry.getTs(),
                entry.getRunId(),
                entry.getLeadId(),
                entry.getStage(),
                entry.getLevel(),
                entry.getMessage());
    }
}
