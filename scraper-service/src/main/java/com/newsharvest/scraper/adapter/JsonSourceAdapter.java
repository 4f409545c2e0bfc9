package com.newsharvest.scraper.adapter;

/**
 * Source whose pages embed their content as JSON in {@code application/json} script tags.
 *
 * @param mediaBaseUrl   prefix for image keys found in the JSON
 * @param listingPointer JSON pointer to the listing tree inside each script
 * @param detailPointer  JSON pointer to the story object inside a detail page script
 */
public record JsonSourceAdapter(
        String name,
        String displayName,
        String baseUrl,
        String listingUrl,
        String mediaBaseUrl,
        String mediaSubdirectory,
        String listingPointer,
        String detailPointer,
        DiscriminantRules rules,
        JsonFieldKeys fields
) implements SourceAdapter {

    @Override
    public SourceFormat format() {
        return SourceFormat.EMBEDDED_JSON;
    }

    /**
     * Story page URL for a slug, joined with exactly one slash.
     */
    public String storyUrl(String slug) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String path = slug.startsWith("/") ? slug.substring(1) : slug;
        return base + "/" + path;
    }

    public String mediaUrl(String key) {
        return (mediaBaseUrl == null ? "" : mediaBaseUrl) + key;
    }
}
