package com.outreachagent.domain.lead.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Composed outreach copy for a lead: A/B email and A/B LinkedIn DM variants.
 */
@Entity
@Table(name = "messages", indexes = @Index(name = "idx_messages_lead", columnList = "leadId"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Message {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long leadId;

    @Column(columnDefinition = "TEXT")
    private String emailA;

    @Column(columnDefinition = "TEXT")
    private String emailB;

    @Column(columnDefinition = "TEXT")
    private String dmA;

    @Column(columnDefinition = "TEXT")
    private String dmB;

    private String cta;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public Message(Long leadId, String emailA, String emailB, String dmA, String dmB, String cta) {
        this.leadId = leadId;
        this.emailA = emailA;
        this.emailB = emailB;
        this.dmA = dmA;
        this.dmB = dmB;
        this.cta = cta;
        this.createdAt = LocalDateTime.now();
    }
}
