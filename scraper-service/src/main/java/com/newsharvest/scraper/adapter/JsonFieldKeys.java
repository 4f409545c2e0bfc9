package com.newsharvest.scraper.adapter;

import java.util.Set;

/**
 * Key names of an embedded-JSON story and of its content elements.
 */
public record JsonFieldKeys(
        String headline,
        String slug,
        String lastPublishedAt,
        String heroImage,
        String cards,
        String elements,
        String elementType,
        String elementSubtype,
        String text,
        String image,
        Set<String> textTypes,
        String imageType
) {

    public JsonFieldKeys {
        textTypes = textTypes == null ? Set.of() : Set.copyOf(textTypes);
    }

    public static JsonFieldKeys defaults() {
        return new JsonFieldKeys("headline", "slug", "last-published-at", "hero-image-s3-key",
                "cards", "story-elements", "type", "subtype", "text", "image-s3-key",
                Set.of("text", "title"), "image");
    }
}
