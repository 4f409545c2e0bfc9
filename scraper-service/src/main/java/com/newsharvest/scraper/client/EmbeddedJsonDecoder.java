package com.newsharvest.scraper.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsharvest.scraper.exception.DecodeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON payloads a page embeds in {@code <script type="application/json">} tags.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmbeddedJsonDecoder {

    private static final String SCRIPT_SELECTOR = "script[type=application/json]";

    private final ObjectMapper objectMapper;

    /**
     * Decodes every embedded script, in document order. Malformed scripts are skipped.
     */
    public List<JsonNode> decodeScripts(Document document) {
        List<JsonNode> payloads = new ArrayList<>();
        for (Element script : document.select(SCRIPT_SELECTOR)) {
            String json = script.data();
            if (json == null || json.isBlank()) {
                continue;
            }
            try {
                payloads.add(decode(json, document.location()));
            } catch (DecodeException e) {
                log.debug("Skipping malformed JSON script on {}: {}", document.location(), e.getMessage());
            }
        }
        return payloads;
    }

    public JsonNode decode(String json, String url) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed embedded JSON: " + e.getOriginalMessage(), url, e);
        }
    }
}
