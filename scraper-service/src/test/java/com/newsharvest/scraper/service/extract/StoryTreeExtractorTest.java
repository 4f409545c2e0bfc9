package com.newsharvest.scraper.service.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsharvest.scraper.adapter.DiscriminantRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * StoryTreeExtractor unit tests
 */
class StoryTreeExtractorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StoryTreeExtractor extractor = new StoryTreeExtractor();
    private final DiscriminantRules rules = DiscriminantRules.defaults();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private static List<String> slugs(List<ObjectNode> leaves) {
        return leaves.stream().map(leaf -> leaf.path("slug").asText()).toList();
    }

    @Nested
    @DisplayName("Traversal order")
    class Order {

        @Test
        @DisplayName("Stories inside collections are emitted in document order")
        void collectionItemsInDocumentOrder() throws Exception {
            // given
            JsonNode root = json("""
                    {"type":"collection","items":[
                        {"type":"story","story":{"headline":"H1","slug":"a/one"}},
                        {"type":"collection","items":[
                            {"type":"story","story":{"headline":"H2","slug":"a/two"}}
                        ]},
                        {"type":"story","story":{"headline":"H3","slug":"a/three"}}
                    ]}
                    """);

            // when
            List<ObjectNode> leaves = extractor.extract(root, rules);

            // then
            assertThat(slugs(leaves)).containsExactly("a/one", "a/two", "a/three");
        }

        @Test
        @DisplayName("Stories spread over plain objects and arrays keep pre-order")
        void mixedContainersKeepPreOrder() throws Exception {
            // given
            JsonNode root = json("""
                    {"page":{"top":[{"type":"story","story":{"slug":"first"}}],
                             "middle":{"widgets":[[{"type":"story","story":{"slug":"second"}}]]}},
                     "footer":[{"type":"story","story":{"slug":"third"}}]}
                    """);

            // when
            List<ObjectNode> leaves = extractor.extract(root, rules);

            // then
            assertThat(slugs(leaves)).containsExactly("first", "second", "third");
        }
    }

    @Nested
    @DisplayName("Node classification")
    class Classification {

        @Test
        @DisplayName("A collection is expanded through its items only")
        void collectionIgnoresOtherFields() throws Exception {
            // given
            JsonNode root = json("""
                    {"type":"collection",
                     "items":[{"type":"story","story":{"slug":"listed"}}],
                     "featured":{"type":"story","story":{"slug":"hidden"}}}
                    """);

            // when
            List<ObjectNode> leaves = extractor.extract(root, rules);

            // then
            assertThat(slugs(leaves)).containsExactly("listed");
        }

        @Test
        @DisplayName("An object marked as collection without items is scanned like any other object")
        void collectionWithoutItemsIsGeneric() throws Exception {
            // given
            JsonNode root = json("""
                    {"type":"collection","children":[{"type":"story","story":{"slug":"child"}}]}
                    """);

            // when
            List<ObjectNode> leaves = extractor.extract(root, rules);

            // then
            assertThat(slugs(leaves)).containsExactly("child");
        }

        @Test
        @DisplayName("A story is unwrapped one level through the wrapper key")
        void leafIsUnwrapped() throws Exception {
            // given
            JsonNode root = json("""
                    [{"type":"story","id":"7","story":{"headline":"Wrapped","slug":"wrapped"}}]
                    """);

            // when
            List<ObjectNode> leaves = extractor.extract(root, rules);

            // then
            assertThat(leaves).hasSize(1);
            assertThat(leaves.get(0).path("headline").asText()).isEqualTo("Wrapped");
            assertThat(leaves.get(0).has("id")).isFalse();
        }

        @Test
        @DisplayName("A story without a wrapper object is emitted as is")
        void leafWithoutWrapperIsEmittedAsIs() throws Exception {
            // given
            JsonNode root = json("""
                    {"list":[{"type":"story","headline":"Flat","slug":"flat","story":"not-an-object"}]}
                    """);

            // when
            List<ObjectNode> leaves = extractor.extract(root, rules);

            // then
            assertThat(leaves).hasSize(1);
            assertThat(leaves.get(0).path("type").asText()).isEqualTo("story");
            assertThat(leaves.get(0).path("slug").asText()).isEqualTo("flat");
        }

        @Test
        @DisplayName("Stories nested inside a story are still found after it")
        void nestedStoriesAreScanned() throws Exception {
            // given
            JsonNode root = json("""
                    {"type":"story","story":{"slug":"outer",
                        "related":[{"type":"story","story":{"slug":"inner"}}]}}
                    """);

            // when
            List<ObjectNode> leaves = extractor.extract(root, rules);

            // then
            assertThat(slugs(leaves)).containsExactly("outer", "inner");
        }

        @Test
        @DisplayName("The same story reached twice is emitted twice")
        void duplicatesAreKept() throws Exception {
            // given
            JsonNode root = json("""
                    {"a":{"type":"story","story":{"slug":"same"}},
                     "b":[{"type":"story","story":{"slug":"same"}}]}
                    """);

            // when
            List<ObjectNode> leaves = extractor.extract(root, rules);

            // then
            assertThat(slugs(leaves)).containsExactly("same", "same");
        }

        @Test
        @DisplayName("Scalars, empty containers and null roots yield nothing")
        void scalarsYieldNothing() throws Exception {
            assertThat(extractor.extract(json("42"), rules)).isEmpty();
            assertThat(extractor.extract(json("\"story\""), rules)).isEmpty();
            assertThat(extractor.extract(json("{}"), rules)).isEmpty();
            assertThat(extractor.extract(json("[]"), rules)).isEmpty();
            assertThat(extractor.extract(null, rules)).isEmpty();
        }

        @Test
        @DisplayName("Custom discriminant rules are honoured")
        void customRules() throws Exception {
            // given
            DiscriminantRules custom = new DiscriminantRules("kind", "group", "entries", "article", null);
            JsonNode root = json("""
                    {"kind":"group","entries":[{"kind":"article","slug":"custom"},
                                               {"type":"story","story":{"slug":"ignored"}}]}
                    """);

            // when
            List<ObjectNode> leaves = extractor.extract(root, custom);

            // then
            assertThat(slugs(leaves)).containsExactly("custom");
        }
    }

    @Test
    @DisplayName("Very deep trees are walked without overflowing the call stack")
    void deepTreeDoesNotOverflow() {
        // given
        JsonNodeFactory factory = JsonNodeFactory.instance;
        ObjectNode story = factory.objectNode();
        story.put("type", "story");
        story.putObject("story").put("slug", "deep");

        JsonNode current = story;
        for (int depth = 0; depth < 100_000; depth++) {
            if (depth % 2 == 0) {
                ArrayNode array = factory.arrayNode();
                array.add(current);
                current = array;
            } else {
                ObjectNode object = factory.objectNode();
                object.set("child", current);
                current = object;
            }
        }

        // when
        List<ObjectNode> leaves = extractor.extract(current, rules);

        // then
        assertThat(slugs(leaves)).containsExactly("deep");
    }
}
