package com.newsharvest.scraper.service.detail;

import com.newsharvest.scraper.adapter.HtmlSourceAdapter;
import com.newsharvest.scraper.adapter.JsonSourceAdapter;
import com.newsharvest.scraper.adapter.SourceAdapter;
import com.newsharvest.scraper.client.FetchedPage;
import com.newsharvest.scraper.client.HtmlDocumentParser;
import com.newsharvest.scraper.client.HttpFetcher;
import com.newsharvest.scraper.dto.DetailRecord;
import com.newsharvest.scraper.dto.DiscoveryRecord;
import com.newsharvest.scraper.dto.FullRecord;
import com.newsharvest.scraper.exception.ScrapeException;
import com.newsharvest.scraper.mapper.StoryRecordMapper;
import com.newsharvest.scraper.service.media.MediaCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetches the detail page of every discovered story, caches its media and merges the
 * result into a {@link FullRecord}.
 * <p>
 * Stories are processed one at a time with a pause between requests. A story whose
 * page cannot be fetched or does not have the expected layout is logged and left out;
 * the remaining stories are still processed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DetailFetchOrchestrator {

    static final String HERO_IMAGE_NAME = "hero";

    private final HttpFetcher httpFetcher;
    private final HtmlDocumentParser htmlDocumentParser;
    private final JsonDetailExtractor jsonDetailExtractor;
    private final HtmlDetailExtractor htmlDetailExtractor;
    private final MediaCacheService mediaCacheService;
    private final StoryRecordMapper storyRecordMapper;

    /**
     * @param limit    process only the first {@code limit} records; {@code null} or
     *                 non-positive means all
     * @param throttle pause applied between two consecutive stories
     */
    public List<FullRecord> fetchAll(SourceAdapter adapter, List<DiscoveryRecord> records,
                                     Integer limit, RequestThrottle throttle) {
        List<DiscoveryRecord> batch = limit != null && limit > 0 && records.size() > limit
                ? records.subList(0, limit)
                : records;

        List<FullRecord> detailed = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            DiscoveryRecord record = batch.get(i);
            log.info("Scraping {} story {}/{}: {}", adapter.name(), i + 1, batch.size(), record.headline());

            try {
                detailed.add(fetchOne(adapter, record));
            } catch (ScrapeException e) {
                log.warn("Failed to scrape details for: {} ({}: {})",
                        record.headline(), e.getErrorCode(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected error scraping {}: {}", record.url(), e.getMessage(), e);
            }

            if (i < batch.size() - 1) {
                throttle.pause();
            }
        }
        return detailed;
    }

    /**
     * Fetches, extracts and caches a single story.
     *
     * @throws ScrapeException when the page cannot be fetched, parsed or located
     */
    public FullRecord fetchOne(SourceAdapter adapter, DiscoveryRecord record) {
        FetchedPage page = httpFetcher.fetch(record.url());
        Document document = htmlDocumentParser.parse(page);
        ArticleContent content = extractContent(adapter, document);
        DetailRecord detail = cacheMedia(adapter, record, content);
        return storyRecordMapper.merge(record, detail);
    }

    private ArticleContent extractContent(SourceAdapter adapter, Document document) {
        if (adapter instanceof JsonSourceAdapter json) {
            return jsonDetailExtractor.extract(document, json);
        }
        if (adapter instanceof HtmlSourceAdapter html) {
            return htmlDetailExtractor.extract(document, html);
        }
        throw new IllegalArgumentException("Unsupported source adapter: " + adapter.getClass().getName());
    }

    private DetailRecord cacheMedia(SourceAdapter adapter, DiscoveryRecord record, ArticleContent content) {
        String subdirectory = adapter.mediaSubdirectory();
        List<String> localImages = new ArrayList<>(
                mediaCacheService.ensureAll(content.imageUrls(), record.slug(), subdirectory));

        String heroImageLocal = null;
        if (record.hasHeroImage()) {
            heroImageLocal = mediaCacheService
                    .ensure(record.heroImageUrl(), record.slug(), HERO_IMAGE_NAME, subdirectory)
                    .orElse(null);
            if (heroImageLocal != null) {
                localImages.add(heroImageLocal);
            }
        }

        return DetailRecord.builder()
                .headline(content.headline())
                .lastPublishedAt(content.lastPublishedAt())
                .description(content.description())
                .imageUrls(content.imageUrls())
                .localImages(localImages)
                .heroImageLocal(heroImageLocal)
                .build();
    }
}
