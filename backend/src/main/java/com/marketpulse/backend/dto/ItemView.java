package com.marketpulse.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketpulse.backend.model.Item;

import java.time.Instant;
import java.util.Locale;

public record ItemView(
        String id,
        String source,
        String asset,
        Instant ts,
        String text,
        String url,
        double score,
        String label,
        Integer likes,
        Integer reposts,
        Integer replies,
        Boolean llmRelevant,
        Double llmConfidence,
        String llmLabels,
        String llmReason,
        boolean lowRelevance,
        Double impact,
        @JsonProperty("impact_60m") Double impact60m,
        String impactMeta
) {

    public static ItemView from(Item item) {
        return new ItemView(item.getId(), item.getSource().name().toLowerCase(Locale.ROOT), item.getAsset(),
                item.getTs(), item.getText(), item.getUrl(), item.getScore(), item.getLabel(), item.getLikes(),
                item.getReposts(), item.getReplies(), item.getLlmRelevant(), item.getLlmConfidence(),
                item.getLlmLabels(), item.getLlmReason(), item.isLowRelevance(), item.getImpact(),
                item.getImpact60m(), item.getImpactMeta());
    }
}
