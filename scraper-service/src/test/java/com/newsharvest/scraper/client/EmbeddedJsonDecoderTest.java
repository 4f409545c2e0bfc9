package com.newsharvest.scraper.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsharvest.scraper.exception.DecodeException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EmbeddedJsonDecoder unit tests
 */
class EmbeddedJsonDecoderTest {

    private final EmbeddedJsonDecoder decoder = new EmbeddedJsonDecoder(new ObjectMapper());

    @Test
    @DisplayName("Only application/json scripts are decoded and malformed ones are skipped")
    void decodeScripts() {
        // given
        Document document = Jsoup.parse("""
                <html><head>
                <script>var x = {"a": 1};</script>
                <script type="application/json">{broken</script>
                <script type="application/json">{"a": 1}</script>
                <script type="application/json">   </script>
                <script type="application/json">[{"b": "<p>markup</p>"}]</script>
                </head></html>
                """, "https://www.example.com/");

        // when
        List<JsonNode> payloads = decoder.decodeScripts(document);

        // then
        assertThat(payloads).hasSize(2);
        assertThat(payloads.get(0).path("a").asInt()).isEqualTo(1);
        assertThat(payloads.get(1).path(0).path("b").asText()).isEqualTo("<p>markup</p>");
    }

    @Test
    @DisplayName("Malformed JSON raises a decode error carrying the page URL")
    void decodeMalformed() {
        assertThatThrownBy(() -> decoder.decode("{\"a\":", "https://www.example.com/"))
                .isInstanceOf(DecodeException.class)
                .extracting(e -> ((DecodeException) e).getUrl())
                .isEqualTo("https://www.example.com/");
    }
}
