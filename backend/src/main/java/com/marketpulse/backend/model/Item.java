package com.marketpulse.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * A scored text item. The id is the dedup hash, so inserting the same content twice
 * hits the primary key instead of creating a second row.
 */
@Entity
@Table(name = "items")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Item implements Persistable<String> {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ItemSource source;

    @Column(nullable = false, length = 32)
    private String asset;

    @Column(name = "ts", nullable = false)
    private Instant ts;

    @Column(name = "text", nullable = false, length = 8000)
    private String text;

    @Column(length = 1024)
    private String url;

    @Column(nullable = false)
    private double score;

    @Column(length = 32)
    private String label;

    private Integer likes;

    private Integer reposts;

    private Integer replies;

    @Column(name = "llm_relevant")
    private Boolean llmRelevant;

    @Column(name = "llm_confidence")
    private Double llmConfidence;

    @Column(name = "llm_labels", length = 512)
    private String llmLabels;

    @Column(name = "llm_reason", length = 1024)
    private String llmReason;

    @Column(name = "low_relevance", nullable = false)
    private boolean lowRelevance;

    private Double impact;

    @Column(name = "impact_60m")
    private Double impact60m;

    @Column(name = "impact_meta", length = 4000)
    private String impactMeta;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Transient
    private boolean persisted;

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.persisted = true;
    }
}
