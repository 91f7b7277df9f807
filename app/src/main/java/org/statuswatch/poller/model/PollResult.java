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

import java.util.List;

/**
 * Structured outcome of one poll. The poller always returns one of these,
 * never an exception, for failures of the monitored endpoint.
 *
 * @param ok            Whether the final response had a 2xx status
 * @param statusCode    Final HTTP status, null when no response was received
 * @param body          Response body, truncated to the configured maximum
 * @param bodyTruncated Whether the body was truncated
 * @param elapsedMillis Wall time of the whole attempt sequence
 * @param attemptCount  Number of HTTP attempts made
 * @param attempts      Per-attempt records, empty unless debug output is enabled
 * @param errorKind     Failure kind, null on success
 * @param error         Sanitized failure summary, null on success
 * @param authSource    Where the credential came from, null when none was used
 */
@Builder
public record PollResult(boolean ok,
                         Integer statusCode,
                         String body,
                         boolean bodyTruncated,
                         long elapsedMillis,
                         int attemptCount,
                         List<AttemptRecord> attempts,
                         ErrorKind errorKind,
                         String error,
                         String authSource) {

    public PollResult {
        body = body == null ? "" : body;
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    /**
     * Failure that happened before any HTTP attempt (e.g. the credential could not be resolved).
     *
     * @param errorKind Failure kind
     * @param error     Sanitized failure summary
     * @return Failed poll result with zero attempts
     */
    public static PollResult failedBeforeRequest(ErrorKind errorKind, String error) {
        return PollResult.builder()
                .ok(false)
                .errorKind(errorKind)
                .error(error)
                .build();
    }
}
