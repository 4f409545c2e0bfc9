package com.newsharvest.scraper.service.extract;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;

import java.net.URI;

/**
 * Reads URL-valued attributes from Jsoup elements as absolute URLs.
 */
@Slf4j
public final class ElementUrls {

    private ElementUrls() {
    }

    /**
     * Absolute value of {@code attribute}, resolved against the document base URI or,
     * when the document has none, against {@code fallbackBase}.
     */
    public static String absoluteUrl(Element element, String attribute, String fallbackBase) {
        String absolute = element.absUrl(attribute);
        if (!absolute.isEmpty()) {
            return absolute;
        }
        return resolve(fallbackBase, element.attr(attribute));
    }

    /**
     * First candidate of a srcset-style attribute ({@code "url 1x, url 2x"}), made absolute.
     */
    public static String firstSrcsetCandidate(Element element, String attribute, String fallbackBase) {
        String raw = element.attr(attribute);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        // candidates are separated by a comma plus whitespace; bare commas may sit inside a URL
        String first = raw.trim().split(",\\s+")[0].trim().split("\\s+")[0];
        while (first.endsWith(",")) {
            first = first.substring(0, first.length() - 1);
        }
        String base = element.baseUri() == null || element.baseUri().isBlank() ? fallbackBase : element.baseUri();
        return resolve(base, first);
    }

    private static String resolve(String base, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        if (base == null || base.isBlank()) {
            return href.trim();
        }
        try {
            return URI.create(base).resolve(href.trim()).toString();
        } catch (IllegalArgumentException e) {
            log.debug("Cannot resolve {} against {}: {}", href, base, e.getMessage());
            return href.trim();
        }
    }
}
