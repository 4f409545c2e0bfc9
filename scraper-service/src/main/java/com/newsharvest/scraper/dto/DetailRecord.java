package com.newsharvest.scraper.dto;

import lombok.Builder;

import java.util.List;

/**
 * Content of one story's detail page together with the media cached for it.
 *
 * @param localImages cached paths of the body images followed by the hero image,
 *                    failed downloads omitted
 */
@Builder
public record DetailRecord(
        String headline,
        String lastPublishedAt,
        String description,
        List<String> imageUrls,
        List<String> localImages,
        String heroImageLocal
) {

    public DetailRecord {
        description = description == null ? "" : description;
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
        localImages = localImages == null ? List.of() : List.copyOf(localImages);
    }
}
