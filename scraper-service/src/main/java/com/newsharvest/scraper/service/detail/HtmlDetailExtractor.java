package com.newsharvest.scraper.service.detail;

import com.newsharvest.scraper.adapter.HtmlSelectors;
import com.newsharvest.scraper.adapter.HtmlSourceAdapter;
import com.newsharvest.scraper.exception.StructuralMismatchException;
import com.newsharvest.scraper.service.extract.ElementUrls;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts title, date, gallery images and body paragraphs from a server-rendered article.
 */
@Component
public class HtmlDetailExtractor implements DetailExtractor<HtmlSourceAdapter> {

    @Override
    public ArticleContent extract(Document page, HtmlSourceAdapter adapter) {
        HtmlSelectors selectors = adapter.selectors();

        Element article = page.selectFirst(selectors.article());
        if (article == null) {
            throw StructuralMismatchException.missingNode("article section", page.location());
        }

        String headline = "";
        Element title = article.selectFirst(selectors.title());
        if (title != null) {
            headline = title.text();
        }

        String published = null;
        Element time = article.selectFirst(selectors.time());
        if (time != null) {
            published = time.attr(selectors.timeAttribute());
        }

        List<String> imageUrls = new ArrayList<>();
        Element media = article.selectFirst(selectors.mediaContainer());
        if (media != null) {
            for (Element item : media.select(selectors.galleryItem())) {
                Element image = item.selectFirst(selectors.galleryImage());
                if (image == null) {
                    continue;
                }
                String url = ElementUrls.firstSrcsetCandidate(image, selectors.imageAttribute(), adapter.baseUrl());
                if (url != null) {
                    imageUrls.add(url);
                }
            }
        }

        List<String> paragraphs = new ArrayList<>();
        Element body = article.selectFirst(selectors.bodyContainer());
        if (body != null) {
            for (Element paragraph : body.select(selectors.paragraph())) {
                String text = paragraph.text();
                if (!text.isEmpty()) {
                    paragraphs.add(text);
                }
            }
        }

        return new ArticleContent(headline, published, String.join("\n\n", paragraphs), imageUrls);
    }
}
