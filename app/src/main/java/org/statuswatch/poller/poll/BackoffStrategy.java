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

import java.time.Duration;

/**
 * Turns a retry policy's backoff factor into the delay before the next attempt.
 */
public enum BackoffStrategy {

    /**
     * {@code backoff * attempt} seconds: 1.5s, 3s, 4.5s, ...
     */
    LINEAR {
        @Override
        double delaySeconds(double backoff, int attempt) {
            return backoff * attempt;
        }
    },

    /**
     * {@code backoff ^ attempt} seconds: 1.5s, 2.25s, 3.375s, ...
     */
    EXPONENTIAL {
        @Override
        double delaySeconds(double backoff, int attempt) {
            return Math.pow(backoff, attempt);
        }
    };

    abstract double delaySeconds(double backoff, int attempt);

    /**
     * Delay to wait after a failed attempt.
     *
     * @param backoff Backoff factor in seconds, non-negative
     * @param attempt Number of the attempt that just failed, starting at 1
     * @return Delay, never negative
     */
    public Duration delay(double backoff, int attempt) {
        if (backoff <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(Math.round(delaySeconds(backoff, attempt) * 1000));
    }
}
