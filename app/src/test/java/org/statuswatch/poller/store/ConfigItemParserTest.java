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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.statuswatch.poller.config.PollerConfig;
import org.statuswatch.poller.exception.ConfigFormatException;
import org.statuswatch.poller.model.AppConfig;
import org.statuswatch.poller.model.ErrorKind;
import org.statuswatch.poller.model.RetryPolicy;
import org.statuswatch.poller.model.SecretRef;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class ConfigItemParserTest {

    private static final String PLAIN_ITEM = """
            {
              "appName": "m365",
              "method": "get",
              "url": "https://graph.microsoft.com/v1.0/admin/serviceAnnouncement/healthOverviews",
              "headers": {"Accept": "application/json"},
              "query": {"$top": "50"},
              "timeout": 5,
              "secretName": "graph-token",
              "jsonKey": "access_token",
              "authHeader": "Authorization",
              "authPrefix": "Bearer ",
              "retry": {"maxAttempts": 4, "backoff": 2, "retryOn": [502, 503]},
              "preprocessTarget": "microsoft365"
            }
            """;

    private static final String ATTRIBUTE_VALUE_ITEM = """
            {
              "appName": {"S": "m365"},
              "method": {"S": "get"},
              "url": {"S": "https://graph.microsoft.com/v1.0/admin/serviceAnnouncement/healthOverviews"},
              "headers": {"M": {"Accept": {"S": "application/json"}}},
              "query": {"M": {"$top": {"S": "50"}}},
              "timeout": {"N": "5"},
              "secretName": {"S": "graph-token"},
              "jsonKey": {"S": "access_token"},
              "authHeader": {"S": "Authorization"},
              "authPrefix": {"S": "Bearer "},
              "retry": {"M": {"max_attempts": {"N": "4"}, "backoff": {"N": "2"}, "retry_on": {"L": [{"N": "502"}, {"N": "503"}]}}},
              "preprocessTarget": {"S": "microsoft365"}
            }
            """;

    @Mock
    private PollerConfig pollerConfig;

    private ConfigItemParser parser;

    @BeforeEach
    void setUp() {
        lenient().when(pollerConfig.defaultAuthHeader()).thenReturn("Authorization");
        lenient().when(pollerConfig.defaultAuthPrefix()).thenReturn("Bearer ");
        lenient().when(pollerConfig.defaultTimeout()).thenReturn(Duration.ofSeconds(10));
        lenient().when(pollerConfig.defaultMaxAttempts()).thenReturn(3);
        lenient().when(pollerConfig.defaultBackoff()).thenReturn(1.5);
        lenient().when(pollerConfig.defaultRetryOn()).thenReturn(List.of(429, 500, 502, 503, 504));

        parser = new ConfigItemParser(new ObjectMapper(), pollerConfig);
    }

    @Test
    void testParse_PlainItem() {
        // Execute
        AppConfig config = parser.parse("m365", PLAIN_ITEM);

        // Verify
        assertEquals("m365", config.appName());
        assertEquals("GET", config.method());
        assertEquals("https://graph.microsoft.com/v1.0/admin/serviceAnnouncement/healthOverviews", config.url());
        assertEquals(Map.of("Accept", "application/json"), config.headers());
        assertEquals(Map.of("$top", "50"), config.query());
        assertEquals(Duration.ofSeconds(5), config.timeout());
        assertEquals(new SecretRef("graph-token", "access_token"), config.secretRef());
        assertEquals("Authorization", config.authHeaderName());
        assertEquals("Bearer ", config.authPrefix());
        assertEquals(new RetryPolicy(4, 2.0, Set.of(502, 503)), config.retryPolicy());
        assertEquals("microsoft365", config.preprocessTarget());
    }

    @Test
    void testParse_AttributeValueItemEqualsPlainItem() {
        AppConfig plain = parser.parse("m365", PLAIN_ITEM);
        AppConfig typed = parser.parse("m365", ATTRIBUTE_VALUE_ITEM);

        assertEquals(plain, typed);
    }

    @Test
    void testParse_MinimalItemUsesDefaults() {
        // Execute
        AppConfig config = parser.parse("github",
                "{\"url\":\"https://www.githubstatus.com/api/v2/summary.json\",\"preprocessTarget\":\"statuspage\"}");

        // Verify
        assertEquals("GET", config.method());
        assertEquals(Duration.ofSeconds(10), config.timeout());
        assertNull(config.secretRef());
        assertEquals("Authorization", config.authHeaderName());
        assertEquals("Bearer ", config.authPrefix());
        assertEquals(RetryPolicy.defaults(), config.retryPolicy());
        assertEquals(Map.of(), config.headers());
    }

    @Test
    void testParse_NestedAuthAndRequestBlocks() {
        String item = """
                {
                  "request": {"method": "POST", "url": "https://status.example.com/api", "timeout": "2.5"},
                  "auth": {"secretName": "vendor", "jsonKey": "api_key", "headerName": "X-Api-Key", "prefix": ""},
                  "preprocessTarget": "statuspage"
                }
                """;

        AppConfig config = parser.parse("vendor", item);

        assertEquals("POST", config.method());
        assertEquals(Duration.ofMillis(2500), config.timeout());
        assertEquals(new SecretRef("vendor", "api_key"), config.secretRef());
        assertEquals("X-Api-Key", config.authHeaderName());
        assertEquals("", config.authPrefix());
    }

    @Test
    void testParse_RetryOnAsCommaSeparatedString() {
        AppConfig config = parser.parse("app",
                "{\"url\":\"https://x.example\",\"preprocessTarget\":\"statuspage\",\"retry\":{\"retryOn\":\"500, 503\"}}");

        assertEquals(Set.of(500, 503), config.retryPolicy().retryOn());
        assertEquals(3, config.retryPolicy().maxAttempts());
    }

    @Test
    void testParse_InvalidJson() {
        ConfigFormatException e = assertThrows(ConfigFormatException.class, () -> parser.parse("app", "{not json"));
        assertEquals(ErrorKind.CONFIG_FORMAT_ERROR, e.getKind());
    }

    @Test
    void testParse_NotAnObject() {
        assertThrows(ConfigFormatException.class, () -> parser.parse("app", "[1, 2]"));
    }

    @Test
    void testParse_MissingUrl() {
        assertThrows(ConfigFormatException.class,
                () -> parser.parse("app", "{\"preprocessTarget\":\"statuspage\"}"));
    }

    @Test
    void testParse_MissingPreprocessTarget() {
        assertThrows(ConfigFormatException.class,
                () -> parser.parse("app", "{\"url\":\"https://x.example\"}"));
    }

    @Test
    void testParse_ZeroMaxAttemptsRejected() {
        assertThrows(ConfigFormatException.class, () -> parser.parse("app",
                "{\"url\":\"https://x.example\",\"preprocessTarget\":\"statuspage\",\"retry\":{\"maxAttempts\":0}}"));
    }

    @Test
    void testParse_NegativeBackoffRejected() {
        assertThrows(ConfigFormatException.class, () -> parser.parse("app",
                "{\"url\":\"https://x.example\",\"preprocessTarget\":\"statuspage\",\"retry\":{\"backoff\":-1}}"));
    }

    @Test
    void testParse_NonPositiveTimeoutRejected() {
        assertThrows(ConfigFormatException.class, () -> parser.parse("app",
                "{\"url\":\"https://x.example\",\"preprocessTarget\":\"statuspage\",\"timeout\":0}"));
    }

    @Test
    void testParse_AppNameMismatchRejected() {
        assertThrows(ConfigFormatException.class, () -> parser.parse("app",
                "{\"appName\":\"other\",\"url\":\"https://x.example\",\"preprocessTarget\":\"statuspage\"}"));
    }
}
