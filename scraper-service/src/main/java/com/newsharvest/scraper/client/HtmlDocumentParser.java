package com.newsharvest.scraper.client;

import com.newsharvest.scraper.exception.DecodeException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Parses fetched pages with Jsoup, keeping the page URL as base URI so
 * {@code absUrl()} resolves relative links.
 */
@Component
public class HtmlDocumentParser {

    public Document parse(FetchedPage page) {
        try {
            // charset taken from the meta tag or BOM, UTF-8 otherwise
            return Jsoup.parse(new ByteArrayInputStream(page.body()), null, page.url());
        } catch (IOException e) {
            throw new DecodeException("Unreadable HTML from " + page.url(), page.url(), e);
        }
    }
}
