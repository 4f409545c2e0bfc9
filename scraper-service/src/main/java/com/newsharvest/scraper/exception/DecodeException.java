package com.newsharvest.scraper.exception;

/**
 * Malformed JSON embedded in a page.
 */
public class DecodeException extends ScrapeException {

    public DecodeException(String message, String url, Throwable cause) {
        super("DECODE_ERROR", message, url, cause);
    }
}
