package com.newsharvest.scraper.service.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsharvest.scraper.adapter.DiscriminantRules;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Finds story nodes in an arbitrarily nested JSON tree.
 * <p>
 * Traversal is pre-order over an explicit stack, so the result is in document order and
 * deep trees cannot overflow the call stack. Per object node:
 * <ul>
 *   <li>collection: only its items are visited, the node itself is never a story;</li>
 *   <li>story: the (unwrapped) node is emitted, then all of its fields are still scanned;</li>
 *   <li>anything else: every field value is visited.</li>
 * </ul>
 * Arrays visit every element; scalars are ignored. The same story reachable through two
 * paths is emitted twice: de-duplication happens downstream.
 */
@Component
public class StoryTreeExtractor {

    public List<ObjectNode> extract(JsonNode root, DiscriminantRules rules) {
        List<ObjectNode> leaves = new ArrayList<>();
        if (root == null) {
            return leaves;
        }

        Deque<JsonNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            JsonNode node = stack.pop();

            if (node.isObject()) {
                if (rules.isCollection(node)) {
                    stack.push(node.get(rules.itemsKey()));
                    continue;
                }
                if (rules.isLeaf(node)) {
                    leaves.add(rules.unwrap((ObjectNode) node));
                }
                pushChildren(stack, node);
            } else if (node.isArray()) {
                pushChildren(stack, node);
            }
        }
        return leaves;
    }

    // reversed so the first child is popped first
    private static void pushChildren(Deque<JsonNode> stack, JsonNode container) {
        List<JsonNode> children = new ArrayList<>(container.size());
        Iterator<JsonNode> elements = container.elements();
        while (elements.hasNext()) {
            JsonNode child = elements.next();
            if (child.isContainerNode()) {
                children.add(child);
            }
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }
}
