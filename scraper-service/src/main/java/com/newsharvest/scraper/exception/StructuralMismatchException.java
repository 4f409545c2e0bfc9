package com.newsharvest.scraper.exception;

/**
 * The page does not contain the node the source layout expects.
 */
public class StructuralMismatchException extends ScrapeException {

    public StructuralMismatchException(String message, String url) {
        super("STRUCTURE_MISMATCH", message, url);
    }

    public static StructuralMismatchException missingNode(String what, String url) {
        return new StructuralMismatchException("No " + what + " found for " + url, url);
    }
}
