package com.newsharvest.scraper.exception;

/**
 * Base class for failures raised while scraping a source.
 * <p>
 * Every subclass except {@link UnknownSourceException} is recoverable: it is caught at the
 * smallest enclosing unit (script tag, card, story) and turned into a logged skip.
 */
public class ScrapeException extends RuntimeException {

    private final String errorCode;
    private final String url;

    public ScrapeException(String message) {
        super(message);
        this.errorCode = "SCRAPE_ERROR";
        this.url = null;
    }

    public ScrapeException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "SCRAPE_ERROR";
        this.url = null;
    }

    public ScrapeException(String errorCode, String message, String url) {
        super(message);
        this.errorCode = errorCode;
        this.url = url;
    }

    public ScrapeException(String errorCode, String message, String url, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.url = url;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getUrl() {
        return url;
    }
}
