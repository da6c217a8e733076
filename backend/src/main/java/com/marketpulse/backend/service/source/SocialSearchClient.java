package com.marketpulse.backend.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.dto.RawItem;
import com.marketpulse.backend.exception.TransientIngestException;
import com.marketpulse.backend.model.ItemSource;
import com.marketpulse.backend.service.HealthStatusService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Advanced-search client for the social source (twitterapi.io wire format). Keeps a
 * {@code since_time} cursor so each poll only asks for posts newer than the last one seen.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SocialSearchClient {

    private static final DateTimeFormatter CREATED_AT =
            DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ENGLISH);
    private static final Duration CURSOR_OVERLAP = Duration.ofSeconds(60);

    private final PulseProperties properties;
    @Qualifier("sourceRestTemplate")
    private final RestTemplate sourceRestTemplate;
    private final HealthStatusService healthStatusService;
    private final Clock clock;

    private volatile Instant sinceCursor;

    public List<RawItem> search() {
        PulseProperties.Social config = properties.getSocial();
        Instant since = sinceCursor != null
                ? sinceCursor
                : clock.instant().minus(Duration.ofMinutes(Math.max(15, properties.getSpam().getSocial().getMaxAgeMinutes())));
        String query = config.getQuery() + " since_time:" + since.getEpochSecond();

        List<RawItem> items = new ArrayList<>();
        Instant newest = since;
        String cursor = null;
        for (int page = 0; page < config.getMaxPages(); page++) {
            JsonNode body = fetchPage(query, cursor);
            for (JsonNode tweet : body.path("tweets")) {
                if (tweet.path("isReply").asBoolean(false) || tweet.hasNonNull("quoted_tweet")) {
                    continue;
                }
                RawItem item = toRawItem(tweet);
                items.add(item);
                if (item.timestamp().isAfter(newest)) {
                    newest = item.timestamp();
                }
            }
            if (!body.path("has_next_page").asBoolean(false)) {
                break;
            }
            cursor = body.path("next_cursor").asText(null);
            if (cursor == null || cursor.isBlank()) {
                break;
            }
        }
        sinceCursor = newest.minus(CURSOR_OVERLAP);
        healthStatusService.markOk(HealthStatusService.SOCIAL_SOURCE);
        return items;
    }

    private JsonNode fetchPage(String query, String cursor) {
        PulseProperties.Social config = properties.getSocial();
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/twitter/tweet/advanced_search")
                .queryParam("query", query)
                .queryParam("queryType", "Latest");
        if (cursor != null) {
            builder.queryParam("cursor", cursor);
        }
        URI uri = builder.encode().build().toUri();
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-API-Key", config.getApiKey());
        try {
            ResponseEntity<JsonNode> response = sourceRestTemplate.exchange(uri, HttpMethod.GET,
                    new HttpEntity<>(headers), JsonNode.class);
            JsonNode body = response.getBody();
            if (body == null) {
                throw new TransientIngestException("Empty search response");
            }
            return body;
        } catch (HttpStatusCodeException ex) {
            int status = ex.getStatusCode().value();
            if (status == 401 || status == 403) {
                healthStatusService.markDegraded(HealthStatusService.SOCIAL_SOURCE, "unauthorized");
                throw new IllegalStateException("Social search rejected the API key (HTTP " + status + ")", ex);
            }
            if (status == 429 || status == 402 || status >= 500) {
                healthStatusService.markDegraded(HealthStatusService.SOCIAL_SOURCE, "http_" + status);
                throw new TransientIngestException("Social search HTTP " + status, status, ex);
            }
            throw new IllegalStateException("Social search HTTP " + status, ex);
        } catch (ResourceAccessException ex) {
            healthStatusService.markDegraded(HealthStatusService.SOCIAL_SOURCE, "network");
            throw new TransientIngestException("Social search unreachable: " + ex.getMessage(), ex);
        }
    }

    private RawItem toRawItem(JsonNode tweet) {
        Instant ts = parseCreatedAt(tweet.path("createdAt").asText(""));
        String url = tweet.path("url").asText(null);
        return new RawItem(ItemSource.SOCIAL, properties.getAsset(), ts, tweet.path("text").asText(""), url,
                tweet.path("likeCount").asInt(0),
                tweet.path("retweetCount").asInt(0),
                tweet.path("replyCount").asInt(0));
    }

    private Instant parseCreatedAt(String value) {
        if (value.isBlank()) {
            return clock.instant();
        }
        try {
            return ZonedDateTime.parse(value, CREATED_AT).toInstant();
        } catch (DateTimeParseException ex) {
            log.debug("Unparseable createdAt '{}', using fetch time", value);
            return clock.instant();
        }
    }
}
