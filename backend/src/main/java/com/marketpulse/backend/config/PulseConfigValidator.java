package com.marketpulse.backend.config;

import com.marketpulse.backend.exception.FatalConfigException;
import com.marketpulse.backend.service.signal.AlphaCombiner;
import com.marketpulse.backend.util.Timeframes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Cross-field checks that bean validation cannot express. Any problem aborts startup before the
 * loops are started.
 */
@Component
@Slf4j
@Order(0)
@RequiredArgsConstructor
public class PulseConfigValidator implements ApplicationRunner {

    private final PulseProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new FatalConfigException(problems);
        }
        log.info("Configuration OK asset={} feed={} social={} prices={} classifier={}", properties.getAsset(),
                properties.getFeed().isEnabled(), properties.getSocial().isEnabled(),
                properties.getPrices().isEnabled(), properties.getClassifier().isEnabled());
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (properties.getAsset() == null || properties.getAsset().isBlank()) {
            problems.add("pulse.asset is required");
        }

        PulseProperties.Signal signal = properties.getSignal();
        if (signal.getThresholdDown() >= signal.getThresholdUp()) {
            problems.add("pulse.signal.threshold-down must be below threshold-up");
        }
        if (signal.getThresholdUp() <= 0 || signal.getThresholdDown() >= 0) {
            problems.add("pulse.signal thresholds must straddle zero");
        }
        double totalWeight = 0.0;
        for (Map.Entry<String, Double> weight : signal.getWeights().entrySet()) {
            if (!AlphaCombiner.FEATURES.contains(weight.getKey())) {
                problems.add("Unknown weight pulse.signal.weights." + weight.getKey());
            } else if (weight.getValue() == null || weight.getValue() < 0) {
                problems.add("pulse.signal.weights." + weight.getKey() + " must be non-negative");
            } else {
                totalWeight += weight.getValue();
            }
        }
        if (totalWeight <= 0) {
            problems.add("pulse.signal.weights must not all be zero");
        }
        PulseProperties.Hysteresis hysteresis = signal.getHysteresis();
        if (hysteresis.isEnabled() && (hysteresis.getBand() < 0
                || hysteresis.getBand() >= Math.min(signal.getThresholdUp(), -signal.getThresholdDown()))) {
            problems.add("pulse.signal.hysteresis.band must be between 0 and the thresholds");
        }

        if (properties.getFeed().isEnabled()) {
            if (properties.getFeed().getUrls().isEmpty()) {
                problems.add("pulse.feed.urls must not be empty when the feed is enabled");
            }
            properties.getFeed().getUrls().forEach(url -> checkUrl("pulse.feed.urls", url, problems));
        }
        if (properties.getSocial().isEnabled()) {
            if (isBlank(properties.getSocial().getApiKey())) {
                problems.add("pulse.social.api-key is required when the social source is enabled");
            }
            checkUrl("pulse.social.base-url", properties.getSocial().getBaseUrl(), problems);
        }
        checkUrl("pulse.oracle.base-url", properties.getOracle().getBaseUrl(), problems);
        if (properties.getClassifier().isEnabled()) {
            checkUrl("pulse.classifier.base-url", properties.getClassifier().getBaseUrl(), problems);
        }
        if (properties.getPrices().isEnabled()) {
            checkUrl("pulse.prices.base-url", properties.getPrices().getBaseUrl(), problems);
        }
        try {
            Timeframes.parse(properties.getPrices().getTimeframe());
        } catch (IllegalArgumentException ex) {
            problems.add("pulse.prices.timeframe: " + ex.getMessage());
        }
        if (properties.getNotify().isEnabled()
                && (isBlank(properties.getNotify().getBotToken()) || isBlank(properties.getNotify().getChatId()))) {
            problems.add("pulse.notify.bot-token and chat-id are required when notifications are enabled");
        }
        checkPattern("pulse.spam.social.required-pattern", properties.getSpam().getSocial().getRequiredPattern(), problems);
        checkPattern("pulse.spam.feed.required-pattern", properties.getSpam().getFeed().getRequiredPattern(), problems);
        return problems;
    }

    private static void checkUrl(String key, String value, List<String> problems) {
        if (isBlank(value)) {
            problems.add(key + " is required");
            return;
        }
        try {
            URI uri = new URI(value);
            if (uri.getScheme() == null || uri.getHost() == null
                    || !(uri.getScheme().equals("http") || uri.getScheme().equals("https"))) {
                problems.add(key + " is not an http(s) URL: " + value);
            }
        } catch (URISyntaxException ex) {
            problems.add(key + " is not a valid URL: " + value);
        }
    }

    private static void checkPattern(String key, String regex, List<String> problems) {
        if (isBlank(regex)) {
            return;
        }
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException ex) {
            problems.add(key + " does not compile: " + ex.getDescription());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
