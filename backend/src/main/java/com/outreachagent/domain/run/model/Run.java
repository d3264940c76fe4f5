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
 * One end-to-end pipeline execution. Finalized exactly once; afterwards immutable history.
 */
@Entity
@Table(name = "runs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Run {

    public static final String MODE_DRY = "dry";
    public static final String MODE_LIVE = "live";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 10)
    private String mode;

    @Column(nullable = false)
    private boolean aiMode;

    private Integer seed;

    @Column(nullable = false)
    private int requestedCount;

    @Column(nullable = false, updatable = false)
    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    @Column(length = 20)
    private String outcome;

    @Column(nullable = false)
    private int succeeded;

    @Column(nullable = false)
    private int failed;

    public Run(boolean dryRun, boolean aiMode, Integer seed, int requestedCount) {
        this.mode = dryRun ? MODE_DRY : MODE_LIVE;
        this.aiMode = aiMode;
        this.seed = seed;
        this.requestedCount = requestedCount;
        this.startedAt = LocalDateTime.now();
    }

    public boolean isFinished() {
        return finishedAt != null;
    }

    public void finish(String outcome, int succeeded, int failed) {
        if (isFinished()) {
            throw new IllegalStateException("Run " + id + " is already finalized");
        }
        this.outcome = outcome;
        this.succeeded = succeeded;
        this.failed = failed;
        this.finishedAt = LocalDateTime.now();
    }
}
