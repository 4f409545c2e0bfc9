package com.newsharvest.scraper.service.detail;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsharvest.scraper.adapter.JsonFieldKeys;
import com.newsharvest.scraper.adapter.JsonSourceAdapter;
import com.newsharvest.scraper.client.EmbeddedJsonDecoder;
import com.newsharvest.scraper.exception.StructuralMismatchException;
import com.newsharvest.scraper.service.extract.StoryTreeExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts body text and images from the story object embedded in a detail page.
 * <p>
 * The story is looked up at the adapter's detail pointer first; when a script has nothing
 * there, the first story node carrying content cards is used instead. Only content
 * elements with a null subtype count: pull quotes, embeds and the like are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonDetailExtractor implements DetailExtractor<JsonSourceAdapter> {

    private static final Pattern TAG = Pattern.compile("<[^<]+?>");
    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final EmbeddedJsonDecoder embeddedJsonDecoder;
    private final StoryTreeExtractor storyTreeExtractor;

    @Override
    public ArticleContent extract(Document page, JsonSourceAdapter adapter) {
        for (JsonNode payload : embeddedJsonDecoder.decodeScripts(page)) {
            Optional<ObjectNode> story = locateStory(payload, adapter);
            if (story.isPresent()) {
                return extractContent(story.get(), adapter);
            }
        }
        throw StructuralMismatchException.missingNode("story data", page.location());
    }

    Optional<ObjectNode> locateStory(JsonNode payload, JsonSourceAdapter adapter) {
        JsonNode atPointer = payload.at(adapter.detailPointer());
        if (atPointer.isObject()) {
            return Optional.of((ObjectNode) atPointer);
        }
        String cardsKey = adapter.fields().cards();
        return storyTreeExtractor.extract(payload, adapter.rules()).stream()
                .filter(leaf -> leaf.path(cardsKey).isArray())
                .findFirst();
    }

    public ArticleContent extractContent(ObjectNode story, JsonSourceAdapter adapter) {
        JsonFieldKeys keys = adapter.fields();
        List<String> paragraphs = new ArrayList<>();
        List<String> imageUrls = new ArrayList<>();

        for (JsonNode card : story.path(keys.cards())) {
            for (JsonNode element : card.path(keys.elements())) {
                if (!isPlain(element, keys)) {
                    continue;
                }
                String type = element.path(keys.elementType()).asText("");
                if (keys.textTypes().contains(type)) {
                    String text = stripTags(textOf(element, keys.text()));
                    if (!text.isBlank()) {
                        paragraphs.add(text);
                    }
                } else if (type.equals(keys.imageType())) {
                    String imageKey = textOf(element, keys.image());
                    if (!imageKey.isBlank()) {
                        imageUrls.add(adapter.mediaUrl(imageKey));
                    }
                }
            }
        }

        return new ArticleContent(
                textOf(story, keys.headline()),
                textOf(story, keys.lastPublishedAt()),
                String.join(PARAGRAPH_SEPARATOR, paragraphs).trim(),
                imageUrls);
    }

    /**
     * Missing subtype and JSON null both mark a plain element.
     */
    private static boolean isPlain(JsonNode element, JsonFieldKeys keys) {
        JsonNode subtype = element.get(keys.elementSubtype());
        return subtype == null || subtype.isNull();
    }

    static String stripTags(String text) {
        return TAG.matcher(text).replaceAll("");
    }

    private static String textOf(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return "";
        }
        return value.asText();
    }
}
