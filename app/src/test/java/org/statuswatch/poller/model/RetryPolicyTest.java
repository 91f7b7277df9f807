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

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void testDefaults() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(3, policy.maxAttempts());
        assertEquals(1.5, policy.backoff());
        assertEquals(Set.of(429, 500, 502, 503, 504), policy.retryOn());
    }

    @Test
    void testIsRetryable() {
        RetryPolicy policy = new RetryPolicy(3, 1.0, Set.of(500, 503));

        assertTrue(policy.isRetryable(503));
        assertFalse(policy.isRetryable(404));
        assertFalse(policy.isRetryable(200));
    }

    @Test
    void testRejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1.0, Set.of()));
    }

    @Test
    void testRejectsNegativeBackoff() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, -0.5, Set.of()));
    }

    @Test
    void testRetryOnIsCopied() {
        Set<Integer> statuses = new HashSet<>(Set.of(500));
        RetryPolicy policy = new RetryPolicy(2, 0, statuses);
        statuses.add(503);

        assertFalse(policy.isRetryable(503));
    }

    @Test
    void testNullRetryOnMeansNoStatusIsRetryable() {
        RetryPolicy policy = new RetryPolicy(2, 0, null);
        assertFalse(policy.isRetryable(503));
    }
}
