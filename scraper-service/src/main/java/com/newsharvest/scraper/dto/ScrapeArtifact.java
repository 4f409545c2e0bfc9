package com.newsharvest.scraper.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Persisted result of scraping one source.
 */
@JsonPropertyOrder({"source", "scraped_at", "story_count", "stories"})
public record ScrapeArtifact(
        String source,
        @JsonProperty("scraped_at") OffsetDateTime scrapedAt,
        @JsonProperty("story_count") int storyCount,
        List<FullRecord> stories
) {

    public ScrapeArtifact {
        stories = stories == null ? List.of() : List.copyOf(stories);
    }

    public static ScrapeArtifact of(String source, OffsetDateTime scrapedAt, List<FullRecord> stories) {
        return new ScrapeArtifact(source, scrapedAt, stories.size(), stories);
    }
}
