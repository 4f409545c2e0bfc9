package com.newsharvest.scraper.service.detail;

import com.newsharvest.scraper.adapter.SourceAdapter;
import com.newsharvest.scraper.exception.StructuralMismatchException;
import org.jsoup.nodes.Document;

/**
 * Reads story content from a parsed detail page of one source format.
 */
public interface DetailExtractor<A extends SourceAdapter> {

    /**
     * @throws StructuralMismatchException when the page lacks the expected content node
     */
    ArticleContent extract(Document page, A adapter);
}
