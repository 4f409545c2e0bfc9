package com.newsharvest.scraper.adapter;

/**
 * Per-site description of where stories live and how their fields are named.
 * Implementations are plain values handed to the discovery and detail services.
 */
public interface SourceAdapter {

    /**
     * Key used to select the source, e.g. {@code prothom_alo}.
     */
    String name();

    /**
     * Name written into the persisted artifact.
     */
    String displayName();

    SourceFormat format();

    String baseUrl();

    /**
     * Page listing the stories to discover.
     */
    String listingUrl();

    /**
     * Directory placed between {@code images/} and the story slug, or {@code null}.
     */
    String mediaSubdirectory();
}
