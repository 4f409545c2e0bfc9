package com.newsharvest.scraper.adapter;

import com.newsharvest.scraper.config.ScraperProperties;
import com.newsharvest.scraper.config.ScraperProperties.SourceEntry;
import com.newsharvest.scraper.exception.UnknownSourceException;
import com.newsharvest.scraper.mapper.SourceAdapterMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SourceAdapterRegistry unit tests
 */
class SourceAdapterRegistryTest {

    private SourceAdapterRegistry registry;

    @BeforeEach
    void setUp() {
        ScraperProperties properties = new ScraperProperties();
        properties.getSources().add(entry("prothom_alo", SourceFormat.EMBEDDED_JSON, null));
        properties.getSources().add(entry("daily_star", SourceFormat.HTML_CARDS, "daily_star"));
        registry = new SourceAdapterRegistry(properties, new SourceAdapterMapper());
    }

    private static SourceEntry entry(String name, SourceFormat format, String mediaSubdirectory) {
        SourceEntry entry = new SourceEntry();
        entry.setName(name);
        entry.setDisplayName(name + " display");
        entry.setFormat(format);
        entry.setBaseUrl("https://" + name + ".example.com");
        entry.setListingUrl("https://" + name + ".example.com/education");
        entry.setMediaBaseUrl("https://media." + name + ".example.com/");
        entry.setMediaSubdirectory(mediaSubdirectory);
        return entry;
    }

    @Test
    @DisplayName("Configured sources are listed in declaration order")
    void namesInOrder() {
        assertThat(registry.names()).containsExactly("prothom_alo", "daily_star");
        assertThat(registry.all()).extracting(SourceAdapter::format)
                .containsExactly(SourceFormat.EMBEDDED_JSON, SourceFormat.HTML_CARDS);
    }

    @Test
    @DisplayName("Lookup ignores case and surrounding whitespace")
    void lookupIgnoresCase() {
        // when
        SourceAdapter adapter = registry.get(" Prothom_Alo ");

        // then
        assertThat(adapter).isInstanceOf(JsonSourceAdapter.class);
        JsonSourceAdapter json = (JsonSourceAdapter) adapter;
        assertThat(json.listingPointer()).isEqualTo("/qt/data");
        assertThat(json.rules()).isEqualTo(DiscriminantRules.defaults());
        assertThat(json.fields()).isEqualTo(JsonFieldKeys.defaults());
        assertThat(json.mediaSubdirectory()).isNull();
    }

    @Test
    @DisplayName("HTML sources carry their selectors and media subdirectory")
    void htmlSource() {
        // when
        HtmlSourceAdapter adapter = (HtmlSourceAdapter) registry.get("daily_star");

        // then
        assertThat(adapter.selectors()).isEqualTo(HtmlSelectors.defaults());
        assertThat(adapter.mediaSubdirectory()).isEqualTo("daily_star");
    }

    @Test
    @DisplayName("An unknown source name fails with the list of available sources")
    void unknownSource() {
        assertThatThrownBy(() -> registry.get("bbc"))
                .isInstanceOf(UnknownSourceException.class)
                .hasMessageContaining("bbc")
                .hasMessageContaining("prothom_alo, daily_star");
        assertThat(registry.find("bbc")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    @DisplayName("Registering a name again replaces the earlier source")
    void registerReplaces() {
        // given
        HtmlSourceAdapter replacement = new HtmlSourceAdapter("daily_star", "Replacement",
                "https://www.thedailystar.net", "https://www.thedailystar.net/tags/education", null,
                HtmlSelectors.defaults());

        // when
        registry.register(replacement);

        // then
        assertThat(registry.names()).containsExactly("prothom_alo", "daily_star");
        assertThat(registry.get("daily_star").displayName()).isEqualTo("Replacement");
    }

    @Test
    @DisplayName("Source formats parse from their configuration value or enum name")
    void sourceFormatFromValue() {
        assertThat(SourceFormat.fromValue("embedded-json")).isEqualTo(SourceFormat.EMBEDDED_JSON);
        assertThat(SourceFormat.fromValue("HTML_CARDS")).isEqualTo(SourceFormat.HTML_CARDS);
        assertThatThrownBy(() -> SourceFormat.fromValue("rss")).isInstanceOf(IllegalArgumentException.class);
    }
}
