package com.newsharvest.scraper.mapper;

import com.newsharvest.scraper.dto.DetailRecord;
import com.newsharvest.scraper.dto.DiscoveryRecord;
import com.newsharvest.scraper.dto.FullRecord;
import org.springframework.stereotype.Component;

@Component
public class StoryRecordMapper {

    /**
     * Merges a detail record over its discovery record. Detail headline and publish time
     * win when they are non-blank; otherwise the listing values are kept.
     */
    public FullRecord merge(DiscoveryRecord discovery, DetailRecord detail) {
        return FullRecord.builder()
                .headline(firstNonBlank(detail.headline(), discovery.headline()))
                .slug(discovery.slug())
                .url(discovery.url())
                .lastPublishedAt(firstNonBlank(detail.lastPublishedAt(), discovery.lastPublishedAt()))
                .heroImageUrl(discovery.heroImageUrl())
                .heroImageLocal(detail.heroImageLocal())
                .description(detail.description())
                .imageUrls(detail.imageUrls())
                .localImages(detail.localImages())
                .scrapedAt(discovery.scrapedAt())
                .build();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
