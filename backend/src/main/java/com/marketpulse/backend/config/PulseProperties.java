package com.marketpulse.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single configuration tree for the pipeline, bound once at startup from {@code pulse.*}
 * and injected into every component that needs it.
 */
@Configuration
@ConfigurationProperties(prefix = "pulse")
@Data
@Validated
public class PulseProperties {

    @NotBlank
    private String asset = "ETH-USD";

    @Valid
    private Ingest ingest = new Ingest();
    @Valid
    private Spam spam = new Spam();
    @Valid
    private Feed feed = new Feed();
    @Valid
    private Social social = new Social();
    @Valid
    private Oracle oracle = new Oracle();
    @Valid
    private Classifier classifier = new Classifier();
    @Valid
    private Aggregation aggregation = new Aggregation();
    @Valid
    private Signal signal = new Signal();
    @Valid
    private Prices prices = new Prices();
    @Valid
    private Impact impact = new Impact();
    @Valid
    private Events events = new Events();
    private Notify notify = new Notify();
    @Valid
    private Commentary commentary = new Commentary();
    @Valid
    private Loops loops = new Loops();
    @Valid
    private Http http = new Http();

    @Data
    public static class Ingest {
        @Min(0)
        private int dedupCacheSize = 5000;
        @Positive
        private long dedupWindowMinutes = 360;
    }

    @Data
    public static class Spam {
        @Valid
        private SpamProfile social = SpamProfile.social();
        @Valid
        private SpamProfile feed = SpamProfile.feed();
    }

    @Data
    public static class SpamProfile {
        @Min(0)
        private int minLength = 20;
        @Positive
        private int maxLength = 2000;
        @Min(0)
        private int minLikes = 0;
        @Min(0)
        private int minReposts = 0;
        @Min(0)
        private int minReplies = 0;
        @Min(0)
        private int maxHashtags = 6;
        @Min(0)
        private int maxMentions = 4;
        @Min(0)
        private int maxUrls = 3;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxHashtagRatio = 0.4;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxUpperRatio = 0.7;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxSymbolRatio = 0.3;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxRepeatedTokenRatio = 0.5;
        @Min(2)
        private int maxCharRun = 8;
        private boolean rejectForeignCashtags = true;
        private List<String> bannedKeywords = new ArrayList<>();
        /** Regex the text must contain; blank disables the check. */
        private String requiredPattern = "";
        /** Items older than this are dropped; 0 disables the check. */
        @Min(0)
        private long maxAgeMinutes = 0;

        public static SpamProfile social() {
            SpamProfile profile = new SpamProfile();
            profile.setMinLikes(2);
            profile.setMaxAgeMinutes(180);
            profile.setRequiredPattern("(?i)(\\$eth\\b|#eth\\b|\\beth\\b|\\bether\\b|\\bethereum\\b)");
            profile.setBannedKeywords(new ArrayList<>(List.of(
                    "airdrop", "giveaway", "presale", "pre-sale", "whitelist", "wl", "pump", "moon", "gem",
                    "referral", "ref", "telegram", "discord", "tg", "claim", "mint", "launch now", "buy now",
                    "fomo", "join")));
            return profile;
        }

        public static SpamProfile feed() {
            SpamProfile profile = new SpamProfile();
            profile.setMinLength(16);
            profile.setMaxLength(8000);
            profile.setMaxHashtags(50);
            profile.setMaxMentions(50);
            profile.setMaxUrls(20);
            profile.setMaxHashtagRatio(1.0);
            profile.setMaxUpperRatio(0.9);
            profile.setMaxSymbolRatio(0.5);
            profile.setMaxRepeatedTokenRatio(0.8);
            profile.setMaxCharRun(20);
            profile.setRejectForeignCashtags(false);
            return profile;
        }
    }

    @Data
    public static class Feed {
        private boolean enabled = true;
        private List<String> urls = new ArrayList<>(List.of(
                "https://www.coindesk.com/arc/outboundfeeds/rss/",
                "https://cointelegraph.com/rss/tag/ethereum"));
        @Positive
        private long pollSeconds = 120;
        @Positive
        private int maxEntriesPerFeed = 50;
    }

    @Data
    public static class Social {
        private boolean enabled = false;
        private String baseUrl = "https://api.twitterapi.io";
        private String apiKey = "";
        private String query = "($ETH OR #ETH OR ETH OR Ethereum) lang:en -is:retweet -is:reply";
        @Positive
        private long pollSeconds = 60;
        @Positive
        private int maxPages = 2;
        @Positive
        private long idleBackoffMaxSeconds = 300;
    }

    @Data
    public static class Oracle {
        private String baseUrl = "http://localhost:8001";
        @Positive
        private long timeoutMs = 5000;
        @Positive
        private int degradedAfterFailures = 5;
        @Valid
        private Polarity polarity = new Polarity();
    }

    @Data
    public static class Polarity {
        private boolean enabled = false;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.7;
    }

    @Data
    public static class Classifier {
        private boolean enabled = true;
        private String baseUrl = "http://localhost:11434";
        private String model = "llama3.1:8b";
        @Positive
        private int maxQps = 2;
        @Min(0)
        private long acquireTimeoutMs = 2000;
        @Positive
        private long timeoutMs = 15000;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.6;
    }

    @Data
    public static class Aggregation {
        @Positive
        private long halfLifeMinutes = 15;
        @Positive
        private long emaLookbackMinutes = 60;
        @Positive
        private long mentionsWindowMinutes = 15;
        @Positive
        private int baselineDays = 7;
        @Positive
        private double minStddev = 1.0;
        @Positive
        private double zScoreClip = 4.0;
        @Min(0)
        private long baselineRefreshMinutes = 15;
    }

    @Data
    public static class Signal {
        private boolean enabled = true;
        @Positive
        private long tickSeconds = 60;
        private double thresholdUp = 0.33;
        private double thresholdDown = -0.33;
        private boolean excludeLowRelevance = false;
        private Map<String, Double> weights = defaultWeights();
        @Valid
        private Hysteresis hysteresis = new Hysteresis();
        @Valid
        private Scales scales = new Scales();
        @Valid
        private Multipliers multipliers = new Multipliers();
        @Valid
        private Emit emit = new Emit();

        static Map<String, Double> defaultWeights() {
            Map<String, Double> weights = new LinkedHashMap<>();
            weights.put("sentiment", 0.30);
            weights.put("mentions", 0.35);
            weights.put("momentum", 0.15);
            weights.put("rsi", 0.05);
            weights.put("macd", 0.05);
            weights.put("vwap", 0.05);
            weights.put("breakout", 0.05);
            return weights;
        }
    }

    @Data
    public static class Hysteresis {
        private boolean enabled = false;
        /** Alpha must come back inside +/- band before ACCUMULATE or WAIT is released. */
        @DecimalMin("0.0")
        private double band = 0.2;
    }

    @Data
    public static class Scales {
        @Positive
        private double mentionsZ = 2.0;
        @Positive
        private double momentum15mPct = 0.5;
        @Positive
        private double momentum1hPct = 1.0;
        @Positive
        private double macdHistogramPct = 0.1;
        @Positive
        private double vwapBiasPct = 1.0;
    }

    @Data
    public static class Multipliers {
        @Positive
        private double trendUp = 1.15;
        @Positive
        private double trendDown = 0.85;
        @Positive
        private double atrHighPct = 2.0;
        @Positive
        private double atrHigh = 0.85;
        @Positive
        private double atrExtremePct = 4.0;
        @Positive
        private double atrExtreme = 0.7;
    }

    @Data
    public static class Emit {
        @Min(0)
        private long minIntervalSeconds = 5;
        @DecimalMin("0.0")
        private double strongAlpha = 0.66;
    }

    @Data
    public static class Prices {
        private boolean enabled = true;
        private String symbol = "ETHUSDT";
        private String timeframe = "1m";
        private String baseUrl = "https://api.binance.com";
        @Positive
        private long pollSeconds = 30;
        @Positive
        private int fetchLimit = 300;
        @Positive
        private long lookbackMinutes = 300;
        @Positive
        private int minCandles = 30;
        @Valid
        private Indicators indicators = new Indicators();
    }

    @Data
    public static class Indicators {
        @Positive
        private int rsiPeriod = 14;
        @Positive
        private int macdFast = 12;
        @Positive
        private int macdSlow = 26;
        @Positive
        private int macdSignal = 9;
        @Positive
        private int atrPeriod = 14;
        @Positive
        private int trendEmaPeriod = 20;
        @Positive
        private double trendSlopePct = 0.1;
        @Positive
        private long vwapWindowMinutes = 60;
        @Positive
        private long breakoutWindowMinutes = 240;
        @Positive
        private double breakoutMarginPct = 0.05;
    }

    @Data
    public static class Impact {
        private boolean enabled = true;
        @Positive
        private long pollSeconds = 120;
        @Positive
        private int batchSize = 400;
        @Positive
        private long maxAgeHours = 48;
        @Positive
        private int minCandles = 120;
        @Positive
        private int volatilityWindowCandles = 240;
        @Positive
        private double fallbackSigma15 = 0.004;
        @Positive
        private double fallbackSigma60 = 0.008;
    }

    @Data
    public static class Events {
        @Positive
        private int capacity = 500;
        @Positive
        private int maxPageSize = 200;
        @Positive
        private long sseTimeoutMs = 30L * 60L * 1000L;
    }

    @Data
    public static class Notify {
        private boolean enabled = false;
        private String baseUrl = "https://api.telegram.org";
        private String botToken = "";
        private String chatId = "";
    }

    @Data
    public static class Commentary {
        private boolean enabled = true;
        @Positive
        private long minRefreshSeconds = 60;
        @Positive
        private int sampleItems = 8;
    }

    @Data
    public static class Loops {
        private boolean autoStart = true;
        @Min(0)
        private long startupDelaySeconds = 2;
        @Positive
        private long stopTimeoutSeconds = 20;
        @Positive
        private int retryMaxAttempts = 4;
        @Positive
        private long retryBaseDelayMs = 1000;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double retryJitter = 0.2;
    }

    @Data
    public static class Http {
        @Positive
        private int connectTimeoutMs = 5000;
        @Positive
        private int readTimeoutMs = 10000;
    }
}
