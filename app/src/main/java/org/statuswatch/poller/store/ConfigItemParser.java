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
package org.statuswatch.poller.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.statuswatch.poller.common.ValueUtils;
import org.statuswatch.poller.config.PollerConfig;
import org.statuswatch.poller.exception.ConfigFormatException;
import org.statuswatch.poller.model.AppConfig;
import org.statuswatch.poller.model.RetryPolicy;
import org.statuswatch.poller.model.SecretRef;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses a stored config item into an {@link AppConfig}.
 *
 * <p>Accepts plain JSON as well as attribute-value shaped items, numbers given
 * as strings, and both camelCase and snake_case retry keys. Defaults for
 * omitted fields come from {@link PollerConfig}.
 */
@ApplicationScoped
public class ConfigItemParser {

    private final ObjectMapper objectMapper;
    private final PollerConfig pollerConfig;

    @Inject
    public ConfigItemParser(ObjectMapper objectMapper, PollerConfig pollerConfig) {
        this.objectMapper = objectMapper;
        this.pollerConfig = pollerConfig;
    }

    /**
     * Parse a config item.
     *
     * @param appName Application the item was stored under
     * @param content Raw item content
     * @return Parsed configuration
     * @throws ConfigFormatException if the item is not valid JSON or misses required fields
     */
    public AppConfig parse(String appName, String content) {
        JsonNode raw;
        try {
            raw = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ConfigFormatException("Config item for '" + appName + "' is not valid JSON: "
                    + e.getOriginalMessage(), e);
        }
        if (raw == null || !raw.isObject()) {
            throw new ConfigFormatException("Config item for '" + appName + "' must be a JSON object");
        }
        return parse(appName, ValueUtils.unwrapAttributeValues(raw));
    }

    private AppConfig parse(String appName, JsonNode item) {
        String storedName = ValueUtils.asText(item.get("appName"));
        if (storedName != null && !storedName.equals(appName)) {
            throw new ConfigFormatException("Config item stored under '" + appName
                    + "' declares appName '" + storedName + "'");
        }

        JsonNode request = item.path("request");
        JsonNode auth = item.path("auth");

        String url = firstText(item.get("url"), request.get("url"));
        if (url == null) {
            throw new ConfigFormatException("Config item for '" + appName + "' has no url");
        }
        String preprocessTarget = ValueUtils.asText(item.get("preprocessTarget"));
        if (preprocessTarget == null) {
            throw new ConfigFormatException("Config item for '" + appName + "' has no preprocessTarget");
        }

        String method = firstText(item.get("method"), request.get("method"));
        String secretName = firstText(item.get("secretName"), auth.get("secretName"), auth.get("secret_name"));
        String jsonKey = firstText(item.get("jsonKey"), auth.get("jsonKey"), auth.get("json_key"));
        String authHeader = firstText(item.get("authHeader"), auth.get("headerName"), auth.get("header_name"));
        String authPrefix = firstRaw(item.get("authPrefix"), auth.get("prefix"));

        try {
            return AppConfig.builder()
                    .appName(appName)
                    .method(method == null ? "GET" : method.toUpperCase(Locale.ROOT))
                    .url(url)
                    .headers(toStringMap(firstPresent(item.get("headers"), request.get("headers"))))
                    .query(toStringMap(firstPresent(item.get("query"), request.get("query"))))
                    .timeout(parseTimeout(appName, firstPresent(item.get("timeout"), request.get("timeout"))))
                    .secretRef(secretName == null ? null : new SecretRef(secretName, jsonKey))
                    .authHeaderName(authHeader == null ? pollerConfig.defaultAuthHeader() : authHeader)
                    .authPrefix(authPrefix == null ? pollerConfig.defaultAuthPrefix() : authPrefix)
                    .retryPolicy(parseRetryPolicy(item.get("retry")))
                    .preprocessTarget(preprocessTarget)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigFormatException("Invalid config item for '" + appName + "': " + e.getMessage(), e);
        }
    }

    private Duration parseTimeout(String appName, JsonNode node) {
        Double seconds = ValueUtils.asDouble(node, null);
        if (seconds == null) {
            return pollerConfig.defaultTimeout();
        }
        if (seconds <= 0) {
            throw new ConfigFormatException("Config item for '" + appName + "' has non-positive timeout " + seconds);
        }
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    private RetryPolicy parseRetryPolicy(JsonNode retry) {
        int maxAttempts = pollerConfig.defaultMaxAttempts();
        double backoff = pollerConfig.defaultBackoff();
        List<Integer> retryOn = pollerConfig.defaultRetryOn();

        if (retry != null && retry.isObject()) {
            Double attempts = ValueUtils.asDouble(firstPresent(retry.get("maxAttempts"), retry.get("max_attempts")), null);
            if (attempts != null) {
                maxAttempts = attempts.intValue();
            }
            backoff = ValueUtils.asDouble(retry.get("backoff"), backoff);
            retryOn = ValueUtils.asIntList(firstPresent(retry.get("retryOn"), retry.get("retry_on")), retryOn);
        }
        return new RetryPolicy(maxAttempts, backoff, new HashSet<>(retryOn));
    }

    private static Map<String, String> toStringMap(JsonNode node) {
        Map<String, String> result = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return result;
        }
        node.fields().forEachRemaining(field -> {
            JsonNode value = field.getValue();
            if (value != null && !value.isNull()) {
                result.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
            }
        });
        return result;
    }

    private static JsonNode firstPresent(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (candidate != null && !candidate.isNull() && !candidate.isMissingNode()) {
                return candidate;
            }
        }
        return null;
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            String text = ValueUtils.asText(candidate);
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    /**
     * Like {@link #firstText(JsonNode...)} but keeps whitespace-only and empty values,
     * which are meaningful for an auth prefix.
     */
    private static String firstRaw(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (candidate != null && candidate.isValueNode() && !candidate.isNull()) {
                return candidate.asText();
            }
        }
        return null;
    }
}
