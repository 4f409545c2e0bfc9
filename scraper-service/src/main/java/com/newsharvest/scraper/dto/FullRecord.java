package com.newsharvest.scraper.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Discovery fields merged with detail fields; the unit written to the scrape artifact.
 */
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"headline", "slug", "url", "last_published_at", "hero_image_url",
        "hero_image_local", "description", "image_urls", "local_images", "scraped_at"})
public record FullRecord(
        String headline,
        String slug,
        String url,
        @JsonProperty("last_published_at") String lastPublishedAt,
        @JsonProperty("hero_image_url") String heroImageUrl,
        @JsonProperty("hero_image_local") String heroImageLocal,
        String description,
        @JsonProperty("image_urls") List<String> imageUrls,
        @JsonProperty("local_images") List<String> localImages,
        @JsonProperty("scraped_at") OffsetDateTime scrapedAt
) {

    public FullRecord {
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
        localImages = localImages == null ? List.of() : List.copyOf(localImages);
    }
}
