package com.marketpulse.backend.dto;

import com.marketpulse.backend.model.ItemSource;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Filters for the item listing. Null fields do not filter.
 */
@Data
@Builder
public class ItemQuery {
    private ItemSource source;
    private String label;
    private String text;
    private Double minScore;
    private Double maxScore;
    private Instant since;
    private Instant until;
    private Boolean relevant;
    private Integer limit;
    @Builder.Default
    private boolean ascending = false;
}
