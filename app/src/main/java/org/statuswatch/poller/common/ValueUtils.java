/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.statuswatch.poller.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Value coercion helpers for loosely typed configuration items.
 *
 * <p>Config items may be exported either as plain JSON or in the typed
 * attribute-value shape, where every value is wrapped in a single-key object
 * ({@code {"S": "text"}}, {@code {"N": "3"}}, {@code {"M": {...}}}, {@code {"L": [...]}}).
 * Both shapes are accepted and normalized to plain JSON before use.
 */
@UtilityClass
public final class ValueUtils {

    private static final Set<String> ATTRIBUTE_TYPES = Set.of("S", "N", "BOOL", "NULL", "M", "L", "SS", "NS");
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,9}");

    /**
     * Return the value or "unknown" when null.
     *
     * @param value Value to check
     * @return value itself, or "unknown" if null
     */
    public static String getOrUnknown(String value) {
        return value != null ? value : "unknown";
    }

    /**
     * Recursively convert attribute-value shaped JSON into plain JSON.
     * Safe to call on already-plain values: anything that is not a
     * single-key typed wrapper is copied through unchanged.
     *
     * @param node JSON node (may be null)
     * @return plain JSON node (never null)
     */
    public static JsonNode unwrapAttributeValues(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return NODES.nullNode();
        }
        if (node.isArray()) {
            ArrayNode copy = NODES.arrayNode();
            node.forEach(element -> copy.add(unwrapAttributeValues(element)));
            return copy;
        }
        if (!node.isObject()) {
            return node;
        }
        if (node.size() == 1) {
            Map.Entry<String, JsonNode> only = node.fields().next();
            if (ATTRIBUTE_TYPES.contains(only.getKey())) {
                return unwrapTyped(only.getKey(), only.getValue());
            }
        }
        ObjectNode copy = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            copy.set(field.getKey(), unwrapAttributeValues(field.getValue()));
        }
        return copy;
    }

    private static JsonNode unwrapTyped(String type, JsonNode value) {
        return switch (type) {
            case "S" -> NODES.textNode(value.asText());
            case "N" -> parseNumber(value.asText());
            case "BOOL" -> NODES.booleanNode(value.asBoolean());
            case "NULL" -> NODES.nullNode();
            case "M" -> {
                ObjectNode map = NODES.objectNode();
                value.fields().forEachRemaining(e -> map.set(e.getKey(), unwrapAttributeValues(e.getValue())));
                yield map;
            }
            case "NS" -> {
                ArrayNode numbers = NODES.arrayNode();
                value.forEach(element -> numbers.add(parseNumber(element.asText())));
                yield numbers;
            }
            default -> unwrapAttributeValues(value); // L, SS
        };
    }

    private static JsonNode parseNumber(String text) {
        try {
            BigDecimal number = new BigDecimal(text.trim());
            if (number.scale() <= 0) {
                return NODES.numberNode(number.longValueExact());
            }
            return NODES.numberNode(number.doubleValue());
        } catch (NumberFormatException | ArithmeticException e) {
            return NODES.textNode(text);
        }
    }

    /**
     * Read a number from a node that may hold a number or a numeric string.
     *
     * @param node         JSON node (may be null)
     * @param defaultValue Value returned when the node is absent or not numeric
     * @return numeric value or defaultValue
     */
    public static Double asDouble(JsonNode node, Double defaultValue) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return defaultValue;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Read a list of integers from an array of numbers or numeric strings,
     * or from a comma separated string. Entries that cannot be parsed are skipped.
     *
     * @param node         JSON node (may be null)
     * @param defaultValue Value returned when the node is absent
     * @return parsed integers or defaultValue
     */
    public static List<Integer> asIntList(JsonNode node, List<Integer> defaultValue) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return defaultValue;
        }
        List<Integer> result = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                Double value = asDouble(element, null);
                if (value != null) {
                    result.add(value.intValue());
                }
            }
            return result;
        }
        if (node.isTextual()) {
            for (String part : node.asText().split(",")) {
                String trimmed = part.trim();
                if (INTEGER.matcher(trimmed).matches()) {
                    result.add(Integer.parseInt(trimmed));
                }
            }
            return result;
        }
        if (node.isNumber()) {
            return List.of(node.intValue());
        }
        return defaultValue;
    }

    /**
     * Read a non-blank text value.
     *
     * @param node JSON node (may be null)
     * @return text, or null when the node is absent, null or blank
     */
    public static String asText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
