package com.newsharvest.scraper.dto;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a complete scrape of one source.
 *
 * @param discovered   unique stories found on the listing page
 * @param attempted    stories whose detail page was requested, after the limit
 * @param artifactPath saved artifact, or {@code null} when nothing was saved
 */
public record ScrapeReport(
        String source,
        String displayName,
        int discovered,
        int attempted,
        List<FullRecord> stories,
        Path artifactPath
) {

    public ScrapeReport {
        stories = stories == null ? List.of() : List.copyOf(stories);
    }

    public static ScrapeReport empty(String source, String displayName) {
        return new ScrapeReport(source, displayName, 0, 0, List.of(), null);
    }

    public int storyCount() {
        return stories.size();
    }

    /**
     * Stories dropped during the detail phase.
     */
    public int skipped() {
        return attempted - stories.size();
    }
}
