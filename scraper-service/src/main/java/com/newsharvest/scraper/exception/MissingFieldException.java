package com.newsharvest.scraper.exception;

/**
 * A required story field is absent or blank.
 */
public class MissingFieldException extends ScrapeException {

    private final String field;

    public MissingFieldException(String field) {
        super("MISSING_FIELD", "Required field missing: " + field, null);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
