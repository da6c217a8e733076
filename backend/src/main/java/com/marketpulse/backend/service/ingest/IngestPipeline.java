package com.marketpulse.backend.service.ingest;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.dto.IngestReport;
import com.marketpulse.backend.dto.RawItem;
import com.marketpulse.backend.event.EventBusService;
import com.marketpulse.backend.event.EventType;
import com.marketpulse.backend.model.Item;
import com.marketpulse.backend.service.MetricsService;
import com.marketpulse.backend.service.PulseStore;
import com.marketpulse.backend.service.oracle.DomainHint;
import com.marketpulse.backend.service.oracle.Relevance;
import com.marketpulse.backend.service.oracle.RelevanceClassifier;
import com.marketpulse.backend.service.oracle.ScoringOracleAdapter;
import com.marketpulse.backend.service.oracle.SentimentScore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Normalizes, filters, classifies, scores and persists one batch of raw items from a source.
 * Items are handled one at a time and a failure on one item never aborts the batch.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestPipeline {

    static final int MAX_TEXT = 8000;

    private final PulseProperties properties;
    private final TextNormalizer textNormalizer;
    private final RecentHashCache recentHashCache;
    private final SpamRuleEvaluator spamRuleEvaluator;
    private final RelevanceClassifier relevanceClassifier;
    private final ScoringOracleAdapter scoringOracleAdapter;
    private final PulseStore pulseStore;
    private final EventBusService eventBusService;
    private final MetricsService metricsService;
    private final Clock clock;

    public IngestReport ingest(String sourceName, List<RawItem> batch) {
        Tally tally = new Tally();
        for (RawItem raw : batch) {
            tally.seen++;
            try {
                handle(raw, tally);
            } catch (RuntimeException ex) {
                tally.failed++;
                log.error("Failed to ingest item from {}: {}", sourceName, ex.getMessage(), ex);
            }
        }
        IngestReport report = tally.toReport(sourceName);
        log.info("Ingest batch source={} seen={} persisted={} duplicates={} rejected={} unscored={} classifierSkipped={}",
                sourceName, report.seen(), report.persisted(), report.duplicates(), report.rejected(),
                report.unscored(), report.classifierSkipped());
        if (report.seen() > 0) {
            publishBatchEvent(report);
        }
        return report;
    }

    private void handle(RawItem raw, Tally tally) {
        String cleaned = textNormalizer.clean(raw.text());
        String asset = raw.asset() == null ? properties.getAsset() : raw.asset();
        String hash = textNormalizer.dedupHash(cleaned.toLowerCase(Locale.ROOT), raw.source(), asset);
        if (recentHashCache.seenRecently(hash)) {
            tally.duplicates++;
            metricsService.recordDuplicate(sourceTag(raw));
            return;
        }
        if (pulseStore.itemExists(hash)) {
            recentHashCache.remember(hash);
            tally.duplicates++;
            metricsService.recordDuplicate(sourceTag(raw));
            return;
        }

        SpamRuleEvaluator.SpamVerdict verdict = spamRuleEvaluator.evaluate(raw, cleaned);
        if (!verdict.accepted()) {
            for (String reason : verdict.reasons()) {
                tally.rejectReasons.merge(reason, 1, Integer::sum);
                metricsService.recordReject(reason);
            }
            tally.rejected++;
            log.debug("Rejected item source={} reasons={}", raw.source(), verdict.reasons());
            return;
        }

        String text = cleaned.length() > MAX_TEXT ? cleaned.substring(0, MAX_TEXT) : cleaned;
        Optional<Relevance> relevance = relevanceClassifier.classify(text);
        if (relevance.isEmpty()) {
            tally.classifierSkipped++;
        }
        SentimentScore score = scoringOracleAdapter.score(text, DomainHint.forSource(raw.source()));
        if (score.isUnscored()) {
            tally.unscored++;
        }

        boolean lowRelevance = relevance.map(relevanceClassifier::isLowRelevance).orElse(false);
        Item item = Item.builder()
                .id(hash)
                .source(raw.source())
                .asset(asset)
                .ts(raw.timestamp() == null ? clock.instant() : raw.timestamp())
                .text(text)
                .url(raw.url())
                .score(score.score())
                .label(score.label())
                .likes(raw.likes())
                .reposts(raw.reposts())
                .replies(raw.replies())
                .llmRelevant(relevance.map(Relevance::relevant).orElse(null))
                .llmConfidence(relevance.map(Relevance::confidence).orElse(null))
                .llmLabels(relevance.map(r -> String.join(",", r.labels())).orElse(null))
                .llmReason(relevance.map(Relevance::reason).orElse(null))
                .lowRelevance(lowRelevance)
                .createdAt(clock.instant())
                .build();

        PulseStore.AppendOutcome outcome = pulseStore.appendItem(item);
        recentHashCache.remember(hash);
        if (outcome == PulseStore.AppendOutcome.DUPLICATE) {
            tally.duplicates++;
            metricsService.recordDuplicate(sourceTag(raw));
            return;
        }
        tally.persisted++;
        if (lowRelevance) {
            tally.lowRelevance++;
        }
        metricsService.recordItemPersisted(sourceTag(raw));
    }

    private void publishBatchEvent(IngestReport report) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", report.source());
        payload.put("seen", report.seen());
        payload.put("persisted", report.persisted());
        payload.put("duplicates", report.duplicates());
        payload.put("rejected", report.rejected());
        payload.put("reject_reasons", report.rejectReasons());
        payload.put("unscored", report.unscored());
        payload.put("classifier_skipped", report.classifierSkipped());
        eventBusService.publish(EventType.ITEM,
                report.source() + ": +" + report.persisted() + " items (" + report.rejected() + " rejected)",
                payload);
    }

    private static String sourceTag(RawItem raw) {
        return raw.source() == null ? "unknown" : raw.source().name().toLowerCase(Locale.ROOT);
    }

    private static final class Tally {
        private int seen;
        private int persisted;
        private int duplicates;
        private int rejected;
        private int unscored;
        private int classifierSkipped;
        private int lowRelevance;
        private int failed;
        private final Map<String, Integer> rejectReasons = new TreeMap<>();

        IngestReport toReport(String source) {
            return new IngestReport(source, seen, persisted, duplicates, rejected, Map.copyOf(rejectReasons),
                    unscored, classifierSkipped, lowRelevance, failed);
        }
    }
}
