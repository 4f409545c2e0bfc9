package com.newsharvest.scraper.service.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsharvest.scraper.adapter.HtmlSourceAdapter;
import com.newsharvest.scraper.adapter.JsonSourceAdapter;
import com.newsharvest.scraper.adapter.SourceAdapter;
import com.newsharvest.scraper.client.EmbeddedJsonDecoder;
import com.newsharvest.scraper.client.FetchedPage;
import com.newsharvest.scraper.client.HtmlDocumentParser;
import com.newsharvest.scraper.client.HttpFetcher;
import com.newsharvest.scraper.dto.DiscoveryRecord;
import com.newsharvest.scraper.exception.ScrapeException;
import com.newsharvest.scraper.service.extract.StoryDeduplicator;
import com.newsharvest.scraper.service.extract.StoryRecordNormalizer;
import com.newsharvest.scraper.service.extract.StoryTreeExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the stories listed on a source's listing page.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoryDiscoveryService {

    private final HttpFetcher httpFetcher;
    private final HtmlDocumentParser htmlDocumentParser;
    private final EmbeddedJsonDecoder embeddedJsonDecoder;
    private final StoryTreeExtractor storyTreeExtractor;
    private final StoryRecordNormalizer storyRecordNormalizer;
    private final StoryDeduplicator storyDeduplicator;

    /**
     * Fetches the listing page and returns its unique stories in document order.
     * An unreachable or unreadable listing yields an empty list.
     */
    public List<DiscoveryRecord> discover(SourceAdapter adapter) {
        Document listing;
        try {
            FetchedPage page = httpFetcher.fetch(adapter.listingUrl());
            listing = htmlDocumentParser.parse(page);
        } catch (ScrapeException e) {
            log.warn("Cannot load listing of {}: {}", adapter.name(), e.getMessage());
            return List.of();
        }
        return discover(adapter, listing);
    }

    public List<DiscoveryRecord> discover(SourceAdapter adapter, Document listing) {
        List<DiscoveryRecord> candidates;
        if (adapter instanceof JsonSourceAdapter json) {
            candidates = fromEmbeddedJson(listing, json);
        } else if (adapter instanceof HtmlSourceAdapter html) {
            candidates = fromCards(listing, html);
        } else {
            throw new IllegalArgumentException("Unsupported source adapter: " + adapter.getClass().getName());
        }

        List<DiscoveryRecord> unique = storyDeduplicator.dedupe(candidates);
        log.info("Discovered {} stories on {} ({} candidates)", unique.size(), adapter.name(), candidates.size());
        return unique;
    }

    /**
     * Normalises every story node of a decoded tree; duplicates are kept.
     */
    public List<DiscoveryRecord> extractStories(JsonNode tree, JsonSourceAdapter adapter) {
        List<DiscoveryRecord> records = new ArrayList<>();
        for (ObjectNode leaf : storyTreeExtractor.extract(tree, adapter.rules())) {
            storyRecordNormalizer.normalize(leaf, adapter).ifPresent(records::add);
        }
        return records;
    }

    private List<DiscoveryRecord> fromEmbeddedJson(Document listing, JsonSourceAdapter adapter) {
        List<DiscoveryRecord> records = new ArrayList<>();
        for (JsonNode payload : embeddedJsonDecoder.decodeScripts(listing)) {
            JsonNode tree = payload.at(adapter.listingPointer());
            if (tree.isMissingNode()) {
                continue;
            }
            records.addAll(extractStories(tree, adapter));
        }
        return records;
    }

    private List<DiscoveryRecord> fromCards(Document listing, HtmlSourceAdapter adapter) {
        List<DiscoveryRecord> records = new ArrayList<>();
        for (Element card : listing.select(adapter.selectors().card())) {
            storyRecordNormalizer.normalize(card, adapter).ifPresent(records::add);
        }
        return records;
    }
}
