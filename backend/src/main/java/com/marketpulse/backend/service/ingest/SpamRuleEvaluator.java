package com.marketpulse.backend.service.ingest;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.dto.RawItem;
import com.marketpulse.backend.model.ItemSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Anti-spam and shill heuristics. Every rule that fires adds a reason and any reason rejects
 * the item.
 */
@Service
@RequiredArgsConstructor
public class SpamRuleEvaluator {

    private static final Pattern URL = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CASHTAG = Pattern.compile("\\$([A-Za-z]{2,10})\\b");
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}']+");

    private final PulseProperties properties;
    private final Clock clock;

    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public SpamVerdict evaluate(RawItem item, String cleanedText) {
        PulseProperties.SpamProfile profile = profileFor(item.source());
        List<String> reasons = new ArrayList<>();
        String text = cleanedText == null ? "" : cleanedText;
        String lower = text.toLowerCase(Locale.ROOT);

        if (text.length() < profile.getMinLength()) {
            reasons.add("too_short");
        }
        if (text.length() > profile.getMaxLength()) {
            reasons.add("too_long");
        }
        checkFreshness(item, profile, reasons);
        checkEngagement(item, profile, reasons);

        String[] tokens = text.isEmpty() ? new String[0] : text.split(" ");
        int hashtags = 0;
        int mentions = 0;
        for (String token : tokens) {
            if (token.startsWith("#") && token.length() > 1) {
                hashtags++;
            } else if (token.startsWith("@") && token.length() > 1) {
                mentions++;
            }
        }
        int urls = count(URL.matcher(text));
        if (hashtags > profile.getMaxHashtags()) {
            reasons.add("too_many_hashtags");
        }
        if (tokens.length > 0 && (double) hashtags / tokens.length > profile.getMaxHashtagRatio()) {
            reasons.add("hashtag_ratio");
        }
        if (mentions > profile.getMaxMentions()) {
            reasons.add("too_many_mentions");
        }
        if (urls > profile.getMaxUrls()) {
            reasons.add("too_many_urls");
        }

        for (String keyword : profile.getBannedKeywords()) {
            if (keyword != null && !keyword.isBlank() && keywordPattern(keyword).matcher(lower).find()) {
                reasons.add("banned_keyword:" + keyword.toLowerCase(Locale.ROOT));
                break;
            }
        }

        String withoutUrls = URL.matcher(text).replaceAll("");
        checkCharacterMix(withoutUrls, profile, reasons);
        checkRepetition(lower, profile, reasons);

        if (profile.isRejectForeignCashtags() && hasForeignCashtag(text, item.asset())) {
            reasons.add("foreign_cashtag");
        }
        String required = profile.getRequiredPattern();
        if (required != null && !required.isBlank() && !compiled(required).matcher(text).find()) {
            reasons.add("off_topic");
        }
        return new SpamVerdict(reasons.isEmpty(), List.copyOf(reasons));
    }

    public PulseProperties.SpamProfile profileFor(ItemSource source) {
        return source == ItemSource.SOCIAL ? properties.getSpam().getSocial() : properties.getSpam().getFeed();
    }

    private void checkFreshness(RawItem item, PulseProperties.SpamProfile profile, List<String> reasons) {
        if (profile.getMaxAgeMinutes() <= 0 || item.timestamp() == null) {
            return;
        }
        Instant oldest = clock.instant().minus(Duration.ofMinutes(profile.getMaxAgeMinutes()));
        if (item.timestamp().isBefore(oldest)) {
            reasons.add("stale");
        }
    }

    private void checkEngagement(RawItem item, PulseProperties.SpamProfile profile, List<String> reasons) {
        if (valueOf(item.likes()) < profile.getMinLikes()) {
            reasons.add("low_likes");
        }
        if (valueOf(item.reposts()) < profile.getMinReposts()) {
            reasons.add("low_reposts");
        }
        if (valueOf(item.replies()) < profile.getMinReplies()) {
            reasons.add("low_replies");
        }
    }

    private void checkCharacterMix(String text, PulseProperties.SpamProfile profile, List<String> reasons) {
        int letters = 0;
        int upper = 0;
        int symbols = 0;
        int visible = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            visible++;
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) {
                    upper++;
                }
            } else if (!Character.isDigit(c) && c != '#' && c != '@' && c != '$') {
                symbols++;
            }
        }
        if (letters >= 10 && (double) upper / letters > profile.getMaxUpperRatio()) {
            reasons.add("shouting");
        }
        if (visible > 0 && (double) symbols / visible > profile.getMaxSymbolRatio()) {
            reasons.add("symbol_ratio");
        }
    }

    private void checkRepetition(String lower, PulseProperties.SpamProfile profile, List<String> reasons) {
        List<String> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(lower);
        while (matcher.find()) {
            words.add(matcher.group());
        }
        if (words.size() >= 6) {
            double repeated = 1.0 - (double) new HashSet<>(words).size() / words.size();
            if (repeated > profile.getMaxRepeatedTokenRatio()) {
                reasons.add("repetitive_tokens");
            }
        }
        Pattern run = compiled("(\\S)\\1{" + (profile.getMaxCharRun() - 1) + ",}");
        if (run.matcher(lower).find()) {
            reasons.add("repeated_chars");
        }
    }

    private boolean hasForeignCashtag(String text, String asset) {
        String base = baseSymbol(asset);
        Set<String> tags = new HashSet<>();
        Matcher matcher = CASHTAG.matcher(text);
        while (matcher.find()) {
            tags.add(matcher.group(1).toUpperCase(Locale.ROOT));
        }
        tags.remove(base);
        return !tags.isEmpty();
    }

    static String baseSymbol(String asset) {
        if (asset == null) {
            return "";
        }
        int dash = asset.indexOf('-');
        return (dash > 0 ? asset.substring(0, dash) : asset).toUpperCase(Locale.ROOT);
    }

    private Pattern keywordPattern(String keyword) {
        String lowered = keyword.toLowerCase(Locale.ROOT);
        return patternCache.computeIfAbsent("kw:" + lowered,
                k -> Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(lowered) + "(?![\\p{L}\\p{N}])"));
    }

    private Pattern compiled(String regex) {
        return patternCache.computeIfAbsent(regex, Pattern::compile);
    }

    private static int count(Matcher matcher) {
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static int valueOf(Integer value) {
        return value == null ? 0 : value;
    }

    public record SpamVerdict(boolean accepted, List<String> reasons) {
        public String primaryReason() {
            return reasons.isEmpty() ? null : reasons.get(0);
        }
    }
}
