package com.newsharvest.scraper.service.extract;

import com.newsharvest.scraper.dto.DiscoveryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops stories whose slug was already seen. First occurrence wins; fields of later
 * duplicates are discarded, not merged.
 */
@Slf4j
@Component
public class StoryDeduplicator {

    public List<DiscoveryRecord> dedupe(List<DiscoveryRecord> records) {
        Set<String> seenSlugs = new HashSet<>();
        List<DiscoveryRecord> unique = new ArrayList<>(records.size());
        for (DiscoveryRecord record : records) {
            if (record != null && seenSlugs.add(record.slug())) {
                unique.add(record);
            }
        }
        if (unique.size() < records.size()) {
            log.debug("Removed {} duplicate stories", records.size() - unique.size());
        }
        return unique;
    }
}
