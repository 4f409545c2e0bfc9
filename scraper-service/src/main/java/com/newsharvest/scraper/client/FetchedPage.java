package com.newsharvest.scraper.client;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Body of a successful GET. Equality compares the body bytes, not the array reference.
 */
public record FetchedPage(
        String url,
        int statusCode,
        String contentType,
        byte[] body
) {

    public FetchedPage {
        body = body == null ? new byte[0] : body;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FetchedPage other)) return false;
        return statusCode == other.statusCode
                && Objects.equals(url, other.url)
                && Objects.equals(contentType, other.contentType)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(url, statusCode, contentType) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "FetchedPage[url=" + url + ", statusCode=" + statusCode
                + ", contentType=" + contentType + ", bodyLength=" + body.length + "]";
    }
}
