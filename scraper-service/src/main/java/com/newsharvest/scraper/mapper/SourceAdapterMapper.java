package com.newsharvest.scraper.mapper;

import com.newsharvest.scraper.adapter.DiscriminantRules;
import com.newsharvest.scraper.adapter.HtmlSelectors;
import com.newsharvest.scraper.adapter.HtmlSourceAdapter;
import com.newsharvest.scraper.adapter.JsonFieldKeys;
import com.newsharvest.scraper.adapter.JsonSourceAdapter;
import com.newsharvest.scraper.adapter.SourceAdapter;
import com.newsharvest.scraper.config.ScraperProperties.HtmlLayout;
import com.newsharvest.scraper.config.ScraperProperties.JsonLayout;
import com.newsharvest.scraper.config.ScraperProperties.SourceEntry;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;

/**
 * Turns configured source entries into adapter values.
 */
@Component
public class SourceAdapterMapper {

    public SourceAdapter toAdapter(SourceEntry entry) {
        return switch (entry.getFormat()) {
            case EMBEDDED_JSON -> toJsonAdapter(entry);
            case HTML_CARDS -> toHtmlAdapter(entry);
        };
    }

    public JsonSourceAdapter toJsonAdapter(SourceEntry entry) {
        JsonLayout json = entry.getJson();
        DiscriminantRules rules = new DiscriminantRules(
                json.getDiscriminantKey(),
                json.getCollectionMarker(),
                json.getItemsKey(),
                json.getLeafMarker(),
                json.getWrapperKey());
        JsonFieldKeys fields = new JsonFieldKeys(
                json.getHeadlineKey(),
                json.getSlugKey(),
                json.getPublishedKey(),
                json.getHeroImageKey(),
                json.getCardsKey(),
                json.getElementsKey(),
                json.getElementTypeKey(),
                json.getElementSubtypeKey(),
                json.getTextKey(),
                json.getImageKey(),
                new LinkedHashSet<>(json.getTextTypes()),
                json.getImageType());
        return new JsonSourceAdapter(
                entry.getName(),
                entry.getDisplayName(),
                entry.getBaseUrl(),
                entry.getListingUrl(),
                entry.getMediaBaseUrl(),
                blankToNull(entry.getMediaSubdirectory()),
                json.getListingPointer(),
                json.getDetailPointer(),
                rules,
                fields);
    }

    public HtmlSourceAdapter toHtmlAdapter(SourceEntry entry) {
        HtmlLayout html = entry.getHtml();
        HtmlSelectors selectors = new HtmlSelectors(
                html.getCardSelector(),
                html.getHeadlineLinkSelector(),
                html.getHeroImageSelector(),
                html.getImageAttribute(),
                html.getTimeSelector(),
                html.getTimeAttribute(),
                html.getArticleSelector(),
                html.getTitleSelector(),
                html.getMediaContainerSelector(),
                html.getGalleryItemSelector(),
                html.getGalleryImageSelector(),
                html.getBodyContainerSelector(),
                html.getParagraphSelector());
        return new HtmlSourceAdapter(
                entry.getName(),
                entry.getDisplayName(),
                entry.getBaseUrl(),
                entry.getListingUrl(),
                blankToNull(entry.getMediaSubdirectory()),
                selectors);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
