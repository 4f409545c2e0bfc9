package com.newsharvest.scraper.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.newsharvest.scraper.exception.MissingFieldException;
import lombok.Builder;

import java.time.OffsetDateTime;

/**
 * A story found on a listing page, before its detail page is fetched.
 * Headline, slug and url are never blank.
 */
@Builder(toBuilder = true)
public record DiscoveryRecord(
        String slug,
        String headline,
        String url,
        @JsonProperty("last_published_at") String lastPublishedAt,
        @JsonProperty("hero_image_url") String heroImageUrl,
        @JsonProperty("scraped_at") OffsetDateTime scrapedAt
) {

    public DiscoveryRecord {
        requireText(slug, "slug");
        requireText(headline, "headline");
        requireText(url, "url");
    }

    public boolean hasHeroImage() {
        return heroImageUrl != null && !heroImageUrl.isBlank();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MissingFieldException(field);
        }
    }
}
