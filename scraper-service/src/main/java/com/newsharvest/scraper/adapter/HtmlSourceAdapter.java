package com.newsharvest.scraper.adapter;

/**
 * Source whose listing is a grid of server-rendered story cards.
 */
public record HtmlSourceAdapter(
        String name,
        String displayName,
        String baseUrl,
        String listingUrl,
        String mediaSubdirectory,
        HtmlSelectors selectors
) implements SourceAdapter {

    @Override
    public SourceFormat format() {
        return SourceFormat.HTML_CARDS;
    }
}
