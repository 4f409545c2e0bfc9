package com.newsharvest.scraper.adapter;

public enum SourceFormat {
    EMBEDDED_JSON("embedded-json"),
    HTML_CARDS("html-cards");

    private final String value;

    SourceFormat(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SourceFormat fromValue(String value) {
        for (SourceFormat format : SourceFormat.values()) {
            if (format.value.equalsIgnoreCase(value) || format.name().equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown source format: " + value);
    }
}
