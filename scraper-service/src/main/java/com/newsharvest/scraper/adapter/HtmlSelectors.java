package com.newsharvest.scraper.adapter;

/**
 * CSS selectors locating story fields in server-rendered listing and article pages.
 */
public record HtmlSelectors(
        String card,
        String headlineLink,
        String heroImage,
        String imageAttribute,
        String time,
        String timeAttribute,
        String article,
        String title,
        String mediaContainer,
        String galleryItem,
        String galleryImage,
        String bodyContainer,
        String paragraph
) {

    public static HtmlSelectors defaults() {
        return new HtmlSelectors("div.card", "h3.title a", "div.card-image a picture img", "data-srcset",
                "time", "datetime", "article.article-section", "h1.article-title", "div.section-media",
                "span.lg-gallery", "picture img", "div.clearfix", "p:not([class])");
    }
}
