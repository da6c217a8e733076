package com.marketpulse.backend.service.signal;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.model.Item;
import com.marketpulse.backend.service.PulseStore;
import com.marketpulse.backend.service.oracle.SentimentScore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recomputes the sentiment EMA and the current mention count from the persisted item window on
 * every tick, so missed ticks never leave drift behind. The seven-day mention baseline only
 * moves by one bucket per bucket width, so it is rebuilt from history at most once per
 * {@code baseline-refresh-minutes} and reused in between. Zero rebuilds it on every tick.
 */
@Service
@RequiredArgsConstructor
public class RollingAggregator {

    private final PulseProperties properties;
    private final PulseStore pulseStore;
    private final Map<BaselineKey, Baseline> baselines = new ConcurrentHashMap<>();

    public AggregateSnapshot aggregate(String asset, Instant now) {
        PulseProperties.Aggregation config = properties.getAggregation();
        boolean includeLowRelevance = !properties.getSignal().isExcludeLowRelevance();

        Instant emaFrom = now.minus(Duration.ofMinutes(config.getEmaLookbackMinutes()));
        List<Item> scored = pulseStore.itemWindow(asset, emaFrom, now, includeLowRelevance).stream()
                .filter(item -> !SentimentScore.UNSCORED.equals(item.getLabel()))
                .toList();
        double ema = timeAwareEma(scored, Duration.ofMinutes(config.getHalfLifeMinutes()));

        Duration bucket = Duration.ofMinutes(config.getMentionsWindowMinutes());
        int mentions = (int) pulseStore.countItems(asset, now.minus(bucket), now, includeLowRelevance);
        Baseline baseline = baseline(asset, includeLowRelevance, now, bucket);

        double stddev = Math.max(baseline.stddev(), config.getMinStddev());
        double z = (mentions - baseline.mean()) / stddev;
        double clip = config.getZScoreClip();
        z = Math.max(-clip, Math.min(clip, z));
        return new AggregateSnapshot(ema, mentions, baseline.mean(), stddev, z, scored.size());
    }

    private Baseline baseline(String asset, boolean includeLowRelevance, Instant now, Duration bucket) {
        Duration refresh = Duration.ofMinutes(properties.getAggregation().getBaselineRefreshMinutes());
        return baselines.compute(new BaselineKey(asset, includeLowRelevance), (key, cached) -> {
            if (cached != null && cached.bucket().equals(bucket)
                    && !now.isBefore(cached.computedAt()) && now.isBefore(cached.computedAt().plus(refresh))) {
                return cached;
            }
            return computeBaseline(asset, includeLowRelevance, now, bucket);
        });
    }

    private Baseline computeBaseline(String asset, boolean includeLowRelevance, Instant now, Duration bucket) {
        int buckets = (int) (Duration.ofDays(properties.getAggregation().getBaselineDays()).toMinutes() / bucket.toMinutes());
        Instant historyFrom = now.minus(bucket.multipliedBy(buckets + 1L));
        List<Instant> timestamps = pulseStore.itemTimestamps(asset, historyFrom, now.minus(bucket), includeLowRelevance);

        int[] counts = bucketCounts(timestamps, now, bucket, buckets + 1);
        double mean = 0.0;
        for (int k = 1; k <= buckets; k++) {
            mean += counts[k];
        }
        mean /= buckets;
        double variance = 0.0;
        for (int k = 1; k <= buckets; k++) {
            variance += Math.pow(counts[k] - mean, 2);
        }
        double stddev = buckets > 1 ? Math.sqrt(variance / (buckets - 1)) : 0.0;
        return new Baseline(now, bucket, mean, stddev);
    }

    /**
     * Time-aware EMA over items ordered by timestamp. The first score seeds the average; each
     * later score enters with {@code alpha = 1 - 0.5^(dt / halfLife)}, where dt is the gap to the
     * previous item, so a value's weight halves for every half-life of wall-clock time.
     */
    public static double timeAwareEma(List<Item> items, Duration halfLife) {
        if (items.isEmpty()) {
            return 0.0;
        }
        double halfLifeSeconds = halfLife.toMillis() / 1000.0;
        double ema = items.get(0).getScore();
        Instant previous = items.get(0).getTs();
        for (int i = 1; i < items.size(); i++) {
            Item item = items.get(i);
            double dtSeconds = Math.max(0, Duration.between(previous, item.getTs()).toMillis() / 1000.0);
            double alpha = 1.0 - Math.pow(0.5, dtSeconds / halfLifeSeconds);
            ema = alpha * item.getScore() + (1.0 - alpha) * ema;
            previous = item.getTs();
        }
        return ema;
    }

    /**
     * Bucket k holds items whose age is in {@code [k*w, (k + 1)*w)}; bucket 0 is the current window.
     */
    static int[] bucketCounts(List<Instant> timestamps, Instant now, Duration bucket, int size) {
        int[] counts = new int[size];
        long bucketMillis = bucket.toMillis();
        for (Instant ts : timestamps) {
            long age = Duration.between(ts, now).toMillis();
            if (age < 0) {
                continue;
            }
            int index = (int) (age / bucketMillis);
            if (index < size) {
                counts[index]++;
            }
        }
        return counts;
    }

    private record BaselineKey(String asset, boolean includeLowRelevance) {
    }

    private record Baseline(Instant computedAt, Duration bucket, double mean, double stddev) {
    }
}
