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

import java.time.Instant;

/**
 * Debug record of a single HTTP attempt. Holds no request headers and no credential.
 *
 * @param attempt        Attempt number, starting at 1
 * @param status         HTTP status, null when the attempt failed before a response
 * @param error          Sanitized error message, null when a response was received
 * @param timestamp      When the attempt started
 * @param durationMillis Attempt duration
 */
public record AttemptRecord(int attempt, Integer status, String error, Instant timestamp, long durationMillis) {

    public static AttemptRecord response(int attempt, int status, Instant timestamp, long durationMillis) {
        return new AttemptRecord(attempt, status, null, timestamp, durationMillis);
    }

    public static AttemptRecord error(int attempt, String error, Instant timestamp, long durationMillis) {
        return new AttemptRecord(attempt, null, error, timestamp, durationMillis);
    }
}
