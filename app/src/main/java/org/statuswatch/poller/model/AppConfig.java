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
package org.statuswatch.poller.model;

import lombok.Builder;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Per-application poll configuration, read fresh on every execution.
 *
 * @param appName          Application name (unique key)
 * @param method           HTTP method
 * @param url              Target URL, may already contain a query string
 * @param headers          Static request headers
 * @param query            Query parameters, percent-encoded when the request is built
 * @param timeout          Per-attempt timeout
 * @param secretRef        Credential reference, null when the endpoint needs no auth
 * @param authHeaderName   Header carrying the credential
 * @param authPrefix       Prefix prepended to the credential (e.g. "Bearer ")
 * @param retryPolicy      Retry policy
 * @param preprocessTarget Normalizer to run on a successful poll
 */
@Builder(toBuilder = true)
public record AppConfig(String appName,
                        String method,
                        String url,
                        Map<String, String> headers,
                        Map<String, String> query,
                        Duration timeout,
                        SecretRef secretRef,
                        String authHeaderName,
                        String authPrefix,
                        RetryPolicy retryPolicy,
                        String preprocessTarget) {

    public AppConfig {
        Objects.requireNonNull(appName, "appName must not be null");
        Objects.requireNonNull(url, "url must not be null");
        method = method == null ? "GET" : method;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        query = query == null ? Map.of() : Map.copyOf(query);
        timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        authHeaderName = authHeaderName == null ? "Authorization" : authHeaderName;
        authPrefix = authPrefix == null ? "" : authPrefix;
        retryPolicy = retryPolicy == null ? RetryPolicy.defaults() : retryPolicy;
    }
}
