package com.newsharvest.scraper.exception;

import java.util.Collection;

/**
 * Requested source name is not configured. This is the only fatal condition of a run.
 */
public class UnknownSourceException extends ScrapeException {

    private final String sourceName;

    public UnknownSourceException(String sourceName, Collection<String> available) {
        super("UNKNOWN_SOURCE",
                "Unknown source: " + sourceName + ". Available sources: " + String.join(", ", available),
                null);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
