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

import java.util.Set;

/**
 * Retry policy of a poll: attempt budget, backoff factor (seconds) and the
 * HTTP status codes that are worth another attempt.
 *
 * @param maxAttempts Maximum number of attempts, at least 1
 * @param backoff     Backoff factor in seconds, at least 0
 * @param retryOn     Retryable HTTP status codes
 */
public record RetryPolicy(int maxAttempts, double backoff, Set<Integer> retryOn) {

    public static final Set<Integer> DEFAULT_RETRY_ON = Set.of(429, 500, 502, 503, 504);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (backoff < 0 || Double.isNaN(backoff)) {
            throw new IllegalArgumentException("backoff must be >= 0, got " + backoff);
        }
        retryOn = retryOn == null ? Set.of() : Set.copyOf(retryOn);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 1.5, DEFAULT_RETRY_ON);
    }

    public boolean isRetryable(int statusCode) {
        return retryOn.contains(statusCode);
    }
}
