package net.papermentat.support.paperlist;

import tools.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a JSON/YAML document tree and collects every string leaf, depth first in document order.
 * Object keys, numbers, booleans and nulls are ignored.
 */
final class IdentifierLeafCollector {

    private final List<String> leaves = new ArrayList<>();

    static List<String> collect(JsonNode root) {
        IdentifierLeafCollector collector = new IdentifierLeafCollector();
        if (root != null) {
            collector.visit(root);
        }
        return collector.leaves;
    }

    private void visit(JsonNode node) {
        switch (node.getNodeType()) {
            case OBJECT, ARRAY -> {
                for (JsonNode child : node) {
                    visit(child);
                }
            }
            case STRING -> leaves.add(node.asString());
            default -> {
                // scalars other than strings cannot hold identifiers
            }
        }
    }
}
