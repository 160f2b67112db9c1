package net.papermentat.mapper;

import net.papermentat.util.TextUtils;
import org.springframework.lang.Nullable;
import tools.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Package-private static utilities for extracting typed values from provider JSON nodes.
 */
final class ScholarlyJsonSupport {

    private ScholarlyJsonSupport() {
    }

    @Nullable
    static String getTextValue(JsonNode node, String field) {
        if (node == null || !node.has(field)) {
            return null;
        }
        JsonNode fieldNode = node.get(field);
        if (fieldNode.isString()) {
            return TextUtils.emptyToNull(fieldNode.asString());
        }
        if (fieldNode.isNumber()) {
            return fieldNode.asString();
        }
        return null;
    }

    /**
     * First non-blank string of an array field, or the field itself when it is a plain string.
     */
    @Nullable
    static String getFirstTextValue(JsonNode node, String field) {
        if (node == null || !node.has(field)) {
            return null;
        }
        JsonNode fieldNode = node.get(field);
        if (fieldNode.isString()) {
            return TextUtils.emptyToNull(fieldNode.asString());
        }
        if (fieldNode.isArray()) {
            for (JsonNode element : fieldNode) {
                if (element.isString() && !element.asString().isBlank()) {
                    return element.asString().trim();
                }
            }
        }
        return null;
    }

    static List<String> getTextValues(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.has(field) || !node.get(field).isArray()) {
            return values;
        }
        for (JsonNode element : node.get(field)) {
            if (element.isString() && !element.asString().isBlank()) {
                values.add(element.asString().trim());
            }
        }
        return values;
    }

    /**
     * Year from an integer field, or from the leading four digits of a date string.
     */
    @Nullable
    static Integer getYearValue(JsonNode node, String field) {
        if (node == null || !node.has(field)) {
            return null;
        }
        JsonNode fieldNode = node.get(field);
        if (fieldNode.isIntegralNumber()) {
            return fieldNode.asInt();
        }
        if (fieldNode.isString()) {
            return TextUtils.leadingYear(fieldNode.asString().trim());
        }
        return null;
    }

    static boolean isTrue(JsonNode node, String field) {
        if (node == null || !node.has(field)) {
            return false;
        }
        JsonNode fieldNode = node.get(field);
        return fieldNode.isBoolean() && fieldNode.asBoolean();
    }

    @Nullable
    static JsonNode getObject(JsonNode node, String field) {
        if (node == null || !node.has(field)) {
            return null;
        }
        JsonNode fieldNode = node.get(field);
        return fieldNode.isObject() ? fieldNode : null;
    }
}
