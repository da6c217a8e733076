package com.marketpulse.backend.service.ingest;

import com.marketpulse.backend.model.ItemSource;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class TextNormalizer {

    private static final Pattern TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Removes markup and entities and collapses whitespace. Case is preserved; this is the
     * text that gets stored and scored.
     */
    public String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String text = TAGS.matcher(raw).replaceAll(" ");
        text = HtmlUtils.htmlUnescape(text);
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Dedup form: cleaned and case-folded.
     */
    public String normalize(String raw) {
        return clean(raw).toLowerCase(Locale.ROOT);
    }

    public String dedupHash(String normalizedText, ItemSource source, String asset) {
        String material = normalizedText + "|" + source.name().toLowerCase(Locale.ROOT) + "|" + asset;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
