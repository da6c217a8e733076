package com.marketpulse.backend.service.source;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.dto.RawItem;
import com.marketpulse.backend.exception.TransientIngestException;
import com.marketpulse.backend.model.ItemSource;
import com.marketpulse.backend.service.HealthStatusService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Pulls RSS 2.0 and Atom feeds. One failing feed does not stop the others; the batch only
 * fails as a whole when every configured feed failed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RssFeedClient {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.RFC_1123_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME);

    private final PulseProperties properties;
    @Qualifier("sourceRestTemplate")
    private final RestTemplate sourceRestTemplate;
    private final HealthStatusService healthStatusService;
    private final Clock clock;

    public List<RawItem> fetchAll() {
        List<String> urls = properties.getFeed().getUrls();
        List<RawItem> items = new ArrayList<>();
        int failures = 0;
        for (String url : urls) {
            try {
                items.addAll(fetch(url));
            } catch (RestClientException | FeedParseException ex) {
                failures++;
                log.warn("Feed fetch failed url={} : {}", url, ex.getMessage());
            }
        }
        if (!urls.isEmpty() && failures == urls.size()) {
            healthStatusService.markDegraded(HealthStatusService.FEED_SOURCE, "all feeds failing");
            throw new TransientIngestException("All " + failures + " feeds failed");
        }
        healthStatusService.markOk(HealthStatusService.FEED_SOURCE);
        return items;
    }

    List<RawItem> fetch(String url) {
        String body = sourceRestTemplate.getForObject(url, String.class);
        if (body == null || body.isBlank()) {
            return List.of();
        }
        return parse(body, url);
    }

    List<RawItem> parse(String xml, String feedUrl) {
        Document document = readDocument(xml);
        List<RawItem> items = new ArrayList<>();
        int max = properties.getFeed().getMaxEntriesPerFeed();
        NodeList rssItems = document.getElementsByTagName("item");
        for (int i = 0; i < rssItems.getLength() && items.size() < max; i++) {
            Element element = (Element) rssItems.item(i);
            String text = join(childText(element, "title"), childText(element, "description"),
                    childText(element, "content:encoded"));
            Instant published = parseDate(childText(element, "pubDate"));
            items.add(RawItem.of(ItemSource.FEED, properties.getAsset(), published, text, childText(element, "link")));
        }
        NodeList entries = document.getElementsByTagName("entry");
        for (int i = 0; i < entries.getLength() && items.size() < max; i++) {
            Element element = (Element) entries.item(i);
            String text = join(childText(element, "title"), childText(element, "summary"), childText(element, "content"));
            String published = childText(element, "published");
            Instant ts = parseDate(published.isEmpty() ? childText(element, "updated") : published);
            items.add(RawItem.of(ItemSource.FEED, properties.getAsset(), ts, text, atomLink(element)));
        }
        log.debug("Parsed {} entries from {}", items.size(), feedUrl);
        return items;
    }

    private Document readDocument(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setExpandEntityReferences(false);
            factory.setNamespaceAware(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException ex) {
            throw new FeedParseException("Unreadable feed: " + ex.getMessage(), ex);
        }
    }

    private Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return clock.instant();
        }
        String trimmed = value.trim();
        for (DateTimeFormatter formatter : DATE_FORMATS) {
            try {
                return ZonedDateTime.parse(trimmed, formatter).toInstant();
            } catch (DateTimeParseException ex) {
                log.trace("Date '{}' does not match {}", trimmed, formatter);
            }
        }
        log.debug("Unparseable feed date '{}', using fetch time", trimmed);
        return clock.instant();
    }

    private static String atomLink(Element entry) {
        NodeList links = entry.getElementsByTagName("link");
        for (int i = 0; i < links.getLength(); i++) {
            Element link = (Element) links.item(i);
            String rel = link.getAttribute("rel");
            if (rel.isEmpty() || "alternate".equals(rel)) {
                String href = link.getAttribute("href");
                return href.isEmpty() ? link.getTextContent().trim() : href;
            }
        }
        return null;
    }

    private static String childText(Element parent, String tag) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tag.equals(node.getNodeName())) {
                return node.getTextContent() == null ? "" : node.getTextContent().trim();
            }
        }
        return "";
    }

    private static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part != null && !part.isBlank()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(part);
            }
        }
        return sb.toString();
    }

    static class FeedParseException extends RuntimeException {
        FeedParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
