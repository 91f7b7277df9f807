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
package org.statuswatch.poller.preprocess;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;
import org.statuswatch.poller.exception.PreprocessParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Shared parsing helpers for vendor response bodies.
 */
@UtilityClass
class JsonBodies {

    static JsonNode readObject(ObjectMapper objectMapper, String body, String vendor) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PreprocessParseException(vendor + " response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PreprocessParseException(vendor + " response must be a JSON object");
        }
        return root;
    }

    /**
     * Objects of an array field. An absent or null field is an empty list.
     */
    static List<JsonNode> objects(JsonNode parent, String field, String vendor) {
        JsonNode node = parent.get(field);
        List<JsonNode> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (!node.isArray()) {
            throw new PreprocessParseException(vendor + " field '" + field + "' must be an array");
        }
        for (JsonNode element : node) {
            if (!element.isObject()) {
                throw new PreprocessParseException(vendor + " field '" + field + "' must contain objects only");
            }
            result.add(element);
        }
        return result;
    }

    /**
     * Lowercased text with spaces removed, the form vendor status values are matched in.
     */
    static String statusKey(JsonNode node) {
        if (node == null || !node.isValueNode()) {
            return "";
        }
        return node.asText().replace(" ", "").toLowerCase(Locale.ROOT);
    }
}
