package com.newsharvest.scraper.service;

import com.newsharvest.scraper.adapter.SourceAdapter;
import com.newsharvest.scraper.adapter.SourceAdapterRegistry;
import com.newsharvest.scraper.dto.DiscoveryRecord;
import com.newsharvest.scraper.dto.FullRecord;
import com.newsharvest.scraper.dto.ScrapeArtifact;
import com.newsharvest.scraper.dto.ScrapeReport;
import com.newsharvest.scraper.exception.UnknownSourceException;
import com.newsharvest.scraper.repository.ScrapeResultStore;
import com.newsharvest.scraper.service.detail.DetailFetchOrchestrator;
import com.newsharvest.scraper.service.detail.RequestThrottle;
import com.newsharvest.scraper.service.discovery.StoryDiscoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs complete scrapes: discovery, detail fetching, persistence and a reload check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScrapeService {

    private static final int PREVIEW_STORIES = 5;
    private static final int PREVIEW_DESCRIPTION_CHARS = 200;

    private final SourceAdapterRegistry sourceAdapterRegistry;
    private final StoryDiscoveryService storyDiscoveryService;
    private final DetailFetchOrchestrator detailFetchOrchestrator;
    private final ScrapeResultStore scrapeResultStore;
    private final RequestThrottle requestThrottle;

    public List<String> availableSources() {
        return sourceAdapterRegistry.names();
    }

    /**
     * @throws UnknownSourceException when no source has this name
     */
    public ScrapeReport scrape(String sourceName, Integer maxStories) {
        return scrape(sourceAdapterRegistry.get(sourceName), maxStories);
    }

    public ScrapeReport scrape(SourceAdapter adapter, Integer maxStories) {
        log.info("Scraping {} ...", adapter.displayName());

        List<DiscoveryRecord> stories = storyDiscoveryService.discover(adapter);
        if (stories.isEmpty()) {
            log.warn("No stories found for {}. The site structure may have changed.", adapter.name());
            return ScrapeReport.empty(adapter.name(), adapter.displayName());
        }
        logPreview(stories);

        log.info("Scraping detailed content for each story...");
        List<FullRecord> detailed = detailFetchOrchestrator.fetchAll(adapter, stories, maxStories, requestThrottle);
        int attempted = maxStories != null && maxStories > 0 ? Math.min(maxStories, stories.size()) : stories.size();

        if (detailed.isEmpty()) {
            log.warn("No detailed stories found for {}.", adapter.name());
            return new ScrapeReport(adapter.name(), adapter.displayName(), stories.size(), attempted, detailed, null);
        }

        Path artifactPath;
        try {
            artifactPath = scrapeResultStore.save(adapter.displayName(), detailed);
        } catch (UncheckedIOException e) {
            log.error("Could not save {} stories of {}: {}", detailed.size(), adapter.name(), e.getMessage(), e);
            return new ScrapeReport(adapter.name(), adapter.displayName(), stories.size(), attempted, detailed, null);
        }
        scrapeResultStore.load(artifactPath).ifPresentOrElse(
                this::logVerification,
                () -> log.warn("Saved artifact {} could not be read back", artifactPath));

        ScrapeReport report = new ScrapeReport(adapter.name(), adapter.displayName(),
                stories.size(), attempted, detailed, artifactPath);
        log.info("Finished {}: {} stories saved, {} skipped", adapter.name(), report.storyCount(), report.skipped());
        return report;
    }

    /**
     * Scrapes every configured source. A source that fails unexpectedly is reported with
     * zero stories and does not stop the others.
     */
    public Map<String, ScrapeReport> scrapeAll(Integer maxStories) {
        Map<String, ScrapeReport> reports = new LinkedHashMap<>();
        for (SourceAdapter adapter : sourceAdapterRegistry.all()) {
            log.info("Starting scrape for: {}", adapter.name());
            try {
                ScrapeReport report = scrape(adapter, maxStories);
                reports.put(adapter.name(), report);
                log.info("Successfully scraped {} stories from {}", report.storyCount(), adapter.name());
            } catch (RuntimeException e) {
                log.error("Error scraping {}: {}", adapter.name(), e.getMessage(), e);
                reports.put(adapter.name(), ScrapeReport.empty(adapter.name(), adapter.displayName()));
            }
        }
        logSummary(reports);
        return reports;
    }

    private void logPreview(List<DiscoveryRecord> stories) {
        log.info("Found {} stories:", stories.size());
        int shown = Math.min(PREVIEW_STORIES, stories.size());
        for (int i = 0; i < shown; i++) {
            DiscoveryRecord story = stories.get(i);
            log.info("{}. {} | {} | published={} | hero={}", i + 1, story.headline(), story.url(),
                    story.lastPublishedAt(), story.heroImageUrl());
        }
    }

    private void logVerification(ScrapeArtifact artifact) {
        log.info("Successfully loaded {} detailed stories", artifact.storyCount());
        if (artifact.stories().isEmpty()) {
            return;
        }
        FullRecord first = artifact.stories().get(0);
        String description = first.description() == null ? "" : first.description();
        String preview = description.length() > PREVIEW_DESCRIPTION_CHARS
                ? description.substring(0, PREVIEW_DESCRIPTION_CHARS) + "..."
                : description;
        log.info("First story: {} ({})", first.headline(), first.url());
        log.info("Description length: {} characters, local images: {}", description.length(), first.localImages().size());
        log.debug("Description preview: {}", preview);
    }

    private void logSummary(Map<String, ScrapeReport> reports) {
        int total = 0;
        log.info("SCRAPING SUMMARY");
        for (ScrapeReport report : reports.values()) {
            total += report.storyCount();
            log.info("{}: {} stories", report.displayName(), report.storyCount());
        }
        log.info("Total stories across all sources: {}", total);

        for (ScrapeReport report : reports.values()) {
            List<FullRecord> sample = report.stories().subList(0, Math.min(3, report.storyCount()));
            for (int i = 0; i < sample.size(); i++) {
                log.info("{} #{}: {}", report.source(), i + 1, abbreviate(sample.get(i).headline(), 80));
            }
        }
    }

    private static String abbreviate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "...";
    }
}
