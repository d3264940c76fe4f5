package com.outreachagent.domain.lead.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "leads", indexes = @Index(name = "idx_leads_status", columnList = "status"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Lead {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String fullName;

    @Column(nullable = false)
    private String company;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, length = 50)
    private String industry;

    @Column(nullable = false)
    private String website;

    @Column(nullable = false)
    private String email;

    @Column(nullable = false)
    private String linkedin;

    @Column(nullable = false, length = 10)
    private String country;

    @Column(length = 30)
    private String companySize;

    @Column(length = 100)
    private String persona;

    @Column(columnDefinition = "TEXT")
    private String pains;

    @Column(columnDefinition = "TEXT")
    private String triggers;

    private Double confidence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LeadStatus status;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @Builder
    public Lead(String fullName, String company, String title, String industry,
                String website, String email, String linkedin, String country) {
        this.fullName = fullName;
        this.company = company;
        this.title = title;
        this.industry = industry;
        this.website = website;
        this.email = email;
        this.linkedin = linkedin;
        this.country = country;
        this.status = LeadStatus.NEW;
        this.updatedAt = LocalDateTime.now();
    }

    public String getFirstName() {
        String trimmed = fullName.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    /**
     * Moves the lead to {@code next}. Writing the current status again is a no-op.
     *
     * @throws IllegalStateException if the transition would regress or skip a step
     */
    public void advanceTo(LeadStatus next) {
        if (status == next) {
            return;
        }
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    String.format("Lead %d cannot move from %s to %s", id, status, next));
        }
        this.status = next;
    }

    public void applyEnrichment(String companySize, String persona, String pains,
                                String triggers, double confidence) {
        this.companySize = companySize;
        this.persona = persona;
        this.pains = pains;
        this.triggers = triggers;
        this.confidence = confidence;
    }

    public void markDelivered() {
        advanceTo(LeadStatus.DELIVERED);
        this.lastError = null;
    }

    public void markFailed(String error) {
        advanceTo(LeadStatus.FAILED);
        this.lastError = error;
    }

    @PrePersist
    @PreUpdate
    void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
