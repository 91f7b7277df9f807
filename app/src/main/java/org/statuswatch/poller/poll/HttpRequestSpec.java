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

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Fully built request for one poll attempt.
 *
 * <p>Headers include the rendered auth header, so {@link #toString()} redacts them.
 *
 * @param method  HTTP method
 * @param uri     Target URI with the encoded query string
 * @param headers Request headers
 */
public record HttpRequestSpec(String method, URI uri, Map<String, String> headers) {

    public HttpRequestSpec {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(uri, "uri must not be null");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    @Override
    public String toString() {
        return method + " " + uri + " headers=" + HeaderRedactor.redact(headers, null);
    }
}
