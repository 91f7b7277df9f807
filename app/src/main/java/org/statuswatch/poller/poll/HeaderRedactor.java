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

import lombok.experimental.UtilityClass;
import org.statuswatch.poller.common.Constants;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Keeps credentials out of logs and debug output.
 */
@UtilityClass
public final class HeaderRedactor {

    private static final Set<String> SENSITIVE_HEADERS = Set.of("authorization", "x-api-key", "proxy-authorization");

    /**
     * Copy of the headers with sensitive values replaced by {@value Constants#REDACTED}.
     *
     * @param headers         Headers to redact
     * @param authHeaderName  Additional header to treat as sensitive (may be null)
     * @return Redacted copy, sorted by header name
     */
    public static Map<String, String> redact(Map<String, String> headers, String authHeaderName) {
        Map<String, String> redacted = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, value) -> redacted.put(name, isSensitive(name, authHeaderName) ? Constants.REDACTED : value));
        return redacted;
    }

    static boolean isSensitive(String headerName, String authHeaderName) {
        return SENSITIVE_HEADERS.contains(headerName.toLowerCase(Locale.ROOT))
                || headerName.equalsIgnoreCase(authHeaderName);
    }

    /**
     * Replace every occurrence of the credential in a message.
     *
     * @param text       Message, e.g. an exception message (may be null)
     * @param credential Credential value (may be null)
     * @return Scrubbed message
     */
    public static String scrub(String text, String credential) {
        if (text == null || credential == null || credential.isEmpty()) {
            return text;
        }
        return text.replace(credential, Constants.REDACTED);
    }
}
