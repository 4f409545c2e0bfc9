package com.newsharvest.scraper.exception;

/**
 * Network error, timeout or non-2xx response while fetching a URL.
 */
public class TransportException extends ScrapeException {

    private final int statusCode;

    public TransportException(String message, String url) {
        super("TRANSPORT_ERROR", message, url);
        this.statusCode = -1;
    }

    public TransportException(String message, String url, Throwable cause) {
        super("TRANSPORT_ERROR", message, url, cause);
        this.statusCode = -1;
    }

    private TransportException(String message, String url, int statusCode) {
        super("TRANSPORT_ERROR", message, url);
        this.statusCode = statusCode;
    }

    /**
     * Status code of the failed response, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public static TransportException httpStatus(String url, int statusCode) {
        return new TransportException("HTTP " + statusCode + " for " + url, url, statusCode);
    }

    public static TransportException emptyBody(String url) {
        return new TransportException("Empty response from " + url, url);
    }
}
