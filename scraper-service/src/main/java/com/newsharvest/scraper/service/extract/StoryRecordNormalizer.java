package com.newsharvest.scraper.service.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsharvest.scraper.adapter.HtmlSelectors;
import com.newsharvest.scraper.adapter.HtmlSourceAdapter;
import com.newsharvest.scraper.adapter.JsonFieldKeys;
import com.newsharvest.scraper.adapter.JsonSourceAdapter;
import com.newsharvest.scraper.dto.DiscoveryRecord;
import com.newsharvest.scraper.exception.MissingFieldException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Converts a story candidate (JSON leaf or HTML card) into a {@link DiscoveryRecord}.
 * Candidates without a headline or slug yield no record.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoryRecordNormalizer {

    private final Clock clock;

    public Optional<DiscoveryRecord> normalize(ObjectNode leaf, JsonSourceAdapter adapter) {
        try {
            return Optional.of(toRecord(leaf, adapter));
        } catch (MissingFieldException e) {
            log.debug("Dropping {} story candidate: {}", adapter.name(), e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<DiscoveryRecord> normalize(Element card, HtmlSourceAdapter adapter) {
        try {
            return Optional.of(toRecord(card, adapter));
        } catch (MissingFieldException e) {
            log.debug("Dropping {} card: {}", adapter.name(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @throws MissingFieldException when headline or slug is absent or blank
     */
    public DiscoveryRecord toRecord(ObjectNode leaf, JsonSourceAdapter adapter) {
        JsonFieldKeys keys = adapter.fields();
        String headline = require(textOf(leaf, keys.headline()), "headline");
        String slug = require(textOf(leaf, keys.slug()), "slug");

        String heroKey = textOf(leaf, keys.heroImage());
        String heroImageUrl = isBlank(heroKey) ? null : adapter.mediaUrl(heroKey);

        return DiscoveryRecord.builder()
                .headline(headline)
                .slug(slug)
                .url(adapter.storyUrl(slug))
                .lastPublishedAt(textOf(leaf, keys.lastPublishedAt()))
                .heroImageUrl(heroImageUrl)
                .scrapedAt(OffsetDateTime.now(clock))
                .build();
    }

    /**
     * @throws MissingFieldException when the card has no headline link, or its URL yields no slug
     */
    public DiscoveryRecord toRecord(Element card, HtmlSourceAdapter adapter) {
        HtmlSelectors selectors = adapter.selectors();

        Element link = card.selectFirst(selectors.headlineLink());
        if (link == null) {
            throw new MissingFieldException("headline");
        }
        String headline = require(link.text(), "headline");
        String url = require(ElementUrls.absoluteUrl(link, "href", adapter.baseUrl()), "url");
        String slug = require(slugFromUrl(url), "slug");

        String heroImageUrl = null;
        Element heroImage = card.selectFirst(selectors.heroImage());
        if (heroImage != null) {
            heroImageUrl = ElementUrls.firstSrcsetCandidate(heroImage, selectors.imageAttribute(), adapter.baseUrl());
        }

        String published = null;
        Element time = card.selectFirst(selectors.time());
        if (time != null && time.hasAttr(selectors.timeAttribute())) {
            published = time.attr(selectors.timeAttribute());
        }

        return DiscoveryRecord.builder()
                .headline(headline)
                .slug(slug)
                .url(url)
                .lastPublishedAt(published)
                .heroImageUrl(heroImageUrl)
                .scrapedAt(OffsetDateTime.now(clock))
                .build();
    }

    /**
     * Last path segment of a URL, without query string or fragment.
     */
    public static String slugFromUrl(String url) {
        if (url == null) {
            return null;
        }
        String path = url;
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int authority = path.indexOf("://");
        if (authority >= 0 && path.indexOf('/', authority + 3) < 0) {
            return null;
        }
        int slash = path.lastIndexOf('/');
        String slug = slash >= 0 ? path.substring(slash + 1) : path;
        return slug.isBlank() || slug.contains(":") ? null : slug;
    }

    private static String textOf(JsonNode node, String key) {
        if (key == null) {
            return null;
        }
        JsonNode value = node.get(key);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static String require(String value, String field) {
        if (isBlank(value)) {
            throw new MissingFieldException(field);
        }
        return value.trim();
    }

    private static int indexOfAny(String value, char a, char b) {
        int first = value.indexOf(a);
        int second = value.indexOf(b);
        if (first < 0) return second;
        if (second < 0) return first;
        return Math.min(first, second);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
