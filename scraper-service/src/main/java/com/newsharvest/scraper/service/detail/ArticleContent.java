package com.newsharvest.scraper.service.detail;

import java.util.List;

/**
 * What a detail page says about a story, before any media is downloaded.
 */
public record ArticleContent(
        String headline,
        String lastPublishedAt,
        String description,
        List<String> imageUrls
) {

    public ArticleContent {
        description = description == null ? "" : description;
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
    }
}
