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

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.net.URIBuilder;
import org.statuswatch.poller.exception.PollerException;
import org.statuswatch.poller.model.AppConfig;
import org.statuswatch.poller.model.ErrorKind;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Builds the request for a poll from an {@link AppConfig} and a resolved credential.
 */
@Slf4j
@ApplicationScoped
public class RequestFactory {

    private static final Pattern METHOD_TOKEN = Pattern.compile("[A-Z]+");

    /**
     * Build the request.
     *
     * <p>Configured query parameters are appended to any query string already
     * present in the URL, in sorted key order. When a credential is given the
     * auth header is set from it, and a configured header with the same name
     * (case-insensitive) is dropped.
     *
     * @param config     Application configuration
     * @param credential Resolved credential, null for unauthenticated requests
     * @return Request ready to send
     * @throws PollerException with {@link ErrorKind#INVALID_REQUEST} for a malformed URL or method
     */
    public HttpRequestSpec build(AppConfig config, String credential) {
        if (!METHOD_TOKEN.matcher(config.method()).matches()) {
            throw new PollerException(ErrorKind.INVALID_REQUEST,
                    "Unsupported HTTP method '" + config.method() + "' for app '" + config.appName() + "'");
        }
        return new HttpRequestSpec(config.method(), buildUri(config), buildHeaders(config, credential));
    }

    private URI buildUri(AppConfig config) {
        URI uri;
        try {
            URIBuilder builder = new URIBuilder(config.url());
            new TreeMap<>(config.query()).forEach(builder::addParameter);
            uri = builder.build();
        } catch (URISyntaxException e) {
            throw new PollerException(ErrorKind.INVALID_REQUEST,
                    "Invalid URL for app '" + config.appName() + "': " + e.getMessage(), e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new PollerException(ErrorKind.INVALID_REQUEST,
                    "URL for app '" + config.appName() + "' must be absolute: " + config.url());
        }
        return uri;
    }

    private Map<String, String> buildHeaders(AppConfig config, String credential) {
        Map<String, String> headers = new LinkedHashMap<>();
        config.headers().forEach((name, value) -> {
            if (credential != null && name.equalsIgnoreCase(config.authHeaderName())) {
                log.warn("Ignoring configured header '{}' for app '{}': it would replace the auth header",
                        name, config.appName());
            } else {
                headers.put(name, value);
            }
        });
        if (credential != null) {
            headers.put(config.authHeaderName(), config.authPrefix() + credential);
        }
        return headers;
    }
}
