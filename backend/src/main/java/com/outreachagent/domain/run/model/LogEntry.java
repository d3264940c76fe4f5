package com.outreachagent.domain.run.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Structured audit event written by the stages and the run recorder.
 */
@Entity
@Table(name = "logs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long runId;

    private Long leadId;

    @Column(nullable = false, length = 30)
    private String stage;

    @Column(nullable = false, length = 10)
    private String level;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(nullable = false)
    private LocalDateTime ts;

    public LogEntry(Long runId, Long leadId, String stage, String level, String message) {
        this.runId = runId;
        this.leadId = leadId;
        this.stage = stage;
        this.level = level;
        this.message = message;
        this.ts = LocalDateTime.now();
    }
}
