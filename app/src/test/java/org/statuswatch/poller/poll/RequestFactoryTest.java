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
package org.statuswatch.poller.poll;

import org.junit.jupiter.api.Test;
import org.statuswatch.poller.exception.PollerException;
import org.statuswatch.poller.model.AppConfig;
import org.statuswatch.poller.model.ErrorKind;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestFactoryTest {

    private final RequestFactory factory = new RequestFactory();

    private static AppConfig.AppConfigBuilder config() {
        return AppConfig.builder()
                .appName("app")
                .url("https://status.example.com/api/v2/summary.json")
                .authHeaderName("Authorization")
                .authPrefix("Bearer ")
                .preprocessTarget("statuspage");
    }

    @Test
    void testBuild_AddsAuthHeader() {
        HttpRequestSpec request = factory.build(config().build(), "abc");

        assertEquals("GET", request.method());
        assertEquals("Bearer abc", request.headers().get("Authorization"));
    }

    @Test
    void testBuild_ConfiguredHeaderCannotReplaceAuthHeader() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("authorization", "Bearer evil");
        headers.put("Accept", "application/json");

        HttpRequestSpec request = factory.build(config().headers(headers).build(), "abc");

        assertEquals("Bearer abc", request.headers().get("Authorization"));
        assertFalse(request.headers().containsKey("authorization"));
        assertEquals("application/json", request.headers().get("Accept"));
    }

    @Test
    void testBuild_WithoutCredentialKeepsConfiguredHeaders() {
        HttpRequestSpec request = factory.build(
                config().headers(Map.of("Authorization", "Basic static")).build(), null);

        assertEquals(Map.of("Authorization", "Basic static"), request.headers());
    }

    @Test
    void testBuild_CustomHeaderAndEmptyPrefix() {
        HttpRequestSpec request = factory.build(
                config().authHeaderName("X-Api-Key").authPrefix("").build(), "k-123");

        assertEquals("k-123", request.headers().get("X-Api-Key"));
        assertFalse(request.headers().containsKey("Authorization"));
    }

    @Test
    void testBuild_QueryEncodedInSortedOrder() {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("b", "two words");
        query.put("a", "x&y");

        HttpRequestSpec request = factory.build(config().query(query).build(), null);

        String rawQuery = request.uri().getRawQuery();
        assertTrue(rawQuery.startsWith("a=x%26y&b=two"), rawQuery);
        assertFalse(rawQuery.contains(" "), rawQuery);
    }

    @Test
    void testBuild_PreservesExistingQuery() {
        HttpRequestSpec request = factory.build(
                config().url("https://status.example.com/api?existing=1").query(Map.of("k", "v")).build(), null);

        assertEquals("existing=1&k=v", request.uri().getRawQuery());
    }

    @Test
    void testBuild_MalformedUrl() {
        PollerException e = assertThrows(PollerException.class,
                () -> factory.build(config().url("https://status.example.com/a b").build(), null));
        assertEquals(ErrorKind.INVALID_REQUEST, e.getKind());
    }

    @Test
    void testBuild_RelativeUrl() {
        PollerException e = assertThrows(PollerException.class,
                () -> factory.build(config().url("/api/status").build(), null));
        assertEquals(ErrorKind.INVALID_REQUEST, e.getKind());
    }

    @Test
    void testBuild_InvalidMethod() {
        PollerException e = assertThrows(PollerException.class,
                () -> factory.build(config().method("GE T").build(), null));
        assertEquals(ErrorKind.INVALID_REQUEST, e.getKind());
    }
}
