package com.newsharvest.scraper.client;

import com.newsharvest.scraper.exception.TransportException;

import java.nio.file.Path;
import java.util.Map;

/**
 * Blocking HTTP access used by the scrape pipeline.
 * Every failure, including non-2xx responses and timeouts, surfaces as {@link TransportException}.
 */
public interface HttpFetcher {

    default FetchedPage fetch(String url) {
        return fetch(url, Map.of());
    }

    /**
     * @param headers extra request headers, overriding the defaults of the same name
     */
    FetchedPage fetch(String url, Map<String, String> headers);

    /**
     * Streams the response body of {@code url} into {@code target}, replacing any existing file.
     * On failure the target may hold a partial body; callers own the cleanup.
     */
    void download(String url, Path target);
}
