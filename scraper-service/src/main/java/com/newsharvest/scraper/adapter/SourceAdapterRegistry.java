package com.newsharvest.scraper.adapter;

import com.newsharvest.scraper.config.ScraperProperties;
import com.newsharvest.scraper.exception.UnknownSourceException;
import com.newsharvest.scraper.mapper.SourceAdapterMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of configured sources by name.
 */
@Slf4j
@Component
public class SourceAdapterRegistry {

    private final Map<String, SourceAdapter> adapters = new LinkedHashMap<>();

    public SourceAdapterRegistry(ScraperProperties properties, SourceAdapterMapper mapper) {
        for (ScraperProperties.SourceEntry entry : properties.getSources()) {
            register(mapper.toAdapter(entry));
        }
        log.info("Registered {} scrape sources: {}", adapters.size(), adapters.keySet());
    }

    /**
     * Adds or replaces a source under its own name.
     */
    public void register(SourceAdapter adapter) {
        SourceAdapter previous = adapters.put(key(adapter.name()), adapter);
        if (previous != null) {
            log.warn("Source {} was registered twice, keeping the latest definition", adapter.name());
        }
    }

    /**
     * @throws UnknownSourceException when no source has this name
     */
    public SourceAdapter get(String name) {
        return find(name).orElseThrow(() -> new UnknownSourceException(name, names()));
    }

    public Optional<SourceAdapter> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(adapters.get(key(name)));
    }

    public List<String> names() {
        return new ArrayList<>(adapters.keySet());
    }

    public List<SourceAdapter> all() {
        return List.copyOf(adapters.values());
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
