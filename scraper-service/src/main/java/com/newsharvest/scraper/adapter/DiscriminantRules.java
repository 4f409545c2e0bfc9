package com.newsharvest.scraper.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Classifies JSON objects by a discriminant field.
 *
 * @param discriminantKey  field holding the node type, e.g. {@code type}
 * @param collectionMarker discriminant value of collection nodes
 * @param itemsKey         field holding a collection's children
 * @param leafMarker       discriminant value of story nodes
 * @param wrapperKey       optional field a story node nests its payload under
 */
public record DiscriminantRules(
        String discriminantKey,
        String collectionMarker,
        String itemsKey,
        String leafMarker,
        String wrapperKey
) {

    public static DiscriminantRules defaults() {
        return new DiscriminantRules("type", "collection", "items", "story", "story");
    }

    public boolean isCollection(JsonNode node) {
        return node.isObject()
                && collectionMarker.equals(discriminant(node))
                && node.has(itemsKey);
    }

    public boolean isLeaf(JsonNode node) {
        return node.isObject() && leafMarker.equals(discriminant(node));
    }

    /**
     * Returns the object nested under the wrapper key, or the node itself when there is none.
     */
    public ObjectNode unwrap(ObjectNode node) {
        if (wrapperKey == null) {
            return node;
        }
        JsonNode wrapped = node.get(wrapperKey);
        return wrapped != null && wrapped.isObject() ? (ObjectNode) wrapped : node;
    }

    private String discriminant(JsonNode node) {
        JsonNode value = node.get(discriminantKey);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
