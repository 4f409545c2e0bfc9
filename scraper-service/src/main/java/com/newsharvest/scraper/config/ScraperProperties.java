package com.newsharvest.scraper.config;

import com.newsharvest.scraper.adapter.SourceFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scraper settings bound from {@code application.yml}.
 * <p>
 * Each entry of {@code scraper.sources} becomes one
 * {@link com.newsharvest.scraper.adapter.SourceAdapter}.
 */
@Configuration
@ConfigurationProperties(prefix = "scraper")
@Data
@Validated
public class ScraperProperties {

    @Valid
    private Http http = new Http();

    @Valid
    private Storage storage = new Storage();

    /**
     * Pause between two detail-page requests of the same run
     */
    @NotNull
    private Duration delay = Duration.ofSeconds(2);

    /**
     * Configured sources, in the order "all sources" runs them
     */
    @Valid
    private List<SourceEntry> sources = new ArrayList<>();

    @Data
    public static class Http {

        @NotBlank
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";

        private String acceptLanguage = "bn,en;q=0.9,en-US;q=0.8";

        @Min(100)
        private int connectTimeout = 10000;

        /**
         * Default per-request timeout in milliseconds
         */
        @Min(100)
        private int readTimeout = 30000;

        /**
         * Largest page body buffered in memory, in bytes
         */
        @Min(1024)
        private int maxInMemorySize = 16 * 1024 * 1024;
    }

    @Data
    public static class Storage {

        /**
         * Root of the media cache; returned image paths are relative to it
         */
        @NotBlank
        private String dataDir = "data";

        /**
         * Directory the scrape artifacts are written to
         */
        @NotBlank
        private String outputDir = "data";
    }

    @Data
    public static class SourceEntry {

        /**
         * Key used on the command line, e.g. "prothom_alo"
         */
        @NotBlank
        private String name;

        @NotBlank
        private String displayName;

        @NotNull
        private SourceFormat format;

        @NotBlank
        private String baseUrl;

        @NotBlank
        private String listingUrl;

        /**
         * Prefix prepended to media keys (embedded JSON sources)
         */
        private String mediaBaseUrl;

        /**
         * Optional directory between images/ and the story slug
         */
        private String mediaSubdirectory;

        @Valid
        private JsonLayout json = new JsonLayout();

        @Valid
        private HtmlLayout html = new HtmlLayout();
    }

    @Data
    public static class JsonLayout {

        /**
         * JSON pointer of the listing tree inside each embedded script
         */
        private String listingPointer = "/qt/data";

        /**
         * JSON pointer of the story object inside a detail page script
         */
        private String detailPointer = "/qt/data/story";

        private String discriminantKey = "type";
        private String collectionMarker = "collection";
        private String itemsKey = "items";
        private String leafMarker = "story";
        private String wrapperKey = "story";

        private String headlineKey = "headline";
        private String slugKey = "slug";
        private String publishedKey = "last-published-at";
        private String heroImageKey = "hero-image-s3-key";

        private String cardsKey = "cards";
        private String elementsKey = "story-elements";
        private String elementTypeKey = "type";
        private String elementSubtypeKey = "subtype";
        private String textKey = "text";
        private String imageKey = "image-s3-key";
        private List<String> textTypes = new ArrayList<>(List.of("text", "title"));
        private String imageType = "image";
    }

    @Data
    public static class HtmlLayout {

        private String cardSelector = "div.card";
        private String headlineLinkSelector = "h3.title a";
        private String heroImageSelector = "div.card-image a picture img";
        private String imageAttribute = "data-srcset";
        private String timeSelector = "time";
        private String timeAttribute = "datetime";

        private String articleSelector = "article.article-section";
        private String titleSelector = "h1.article-title";
        private String mediaContainerSelector = "div.section-media";
        private String galleryItemSelector = "span.lg-gallery";
        private String galleryImageSelector = "picture img";
        private String bodyContainerSelector = "div.clearfix";
        private String paragraphSelector = "p:not([class])";
    }
}
