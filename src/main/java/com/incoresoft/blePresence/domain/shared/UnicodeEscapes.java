package com.incoresoft.blePresence.domain.shared;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes literal {@code \\uXXXX} sequences that older receivers left in names,
 * e.g. {@code "\\u5c55\\u533a"} becomes the characters it spells.
 */
public final class UnicodeEscapes {
    private static final Pattern ESCAPE = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

    private UnicodeEscapes() {
    }

    public static String decode(String text) {
        if (text == null || !text.contains("\\u")) return text;
        Matcher m = ESCAPE.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        while (m.find()) {
            char c = (char) Integer.parseInt(m.group(1), 16);
            m.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(c)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Returns a copy of the tree with every text value decoded. Numbers, booleans
     * and nulls are kept as they are; object keys are not touched.
     */
    public static JsonNode decodeTree(JsonNode node) {
        if (node == null) return null;
        if (node.isTextual()) {
            return TextNode.valueOf(decode(node.textValue()));
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode item : node) {
                out.add(decodeTree(item));
            }
            return out;
        }
        if (node.isObject()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                out.set(field.getKey(), decodeTree(field.getValue()));
            }
            return out;
        }
        return node;
    }
}
